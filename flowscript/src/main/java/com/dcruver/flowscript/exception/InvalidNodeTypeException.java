package com.dcruver.flowscript.exception;

import java.util.Map;

public class InvalidNodeTypeException extends QueryException {
    public InvalidNodeTypeException(String nodeId, String expected, String actual) {
        super(ErrorCode.INVALID_NODE_TYPE,
            String.format("Node %s is of type %s, expected %s", nodeId, actual, expected),
            Map.of("nodeId", nodeId, "expected", expected, "actual", actual));
    }
}
