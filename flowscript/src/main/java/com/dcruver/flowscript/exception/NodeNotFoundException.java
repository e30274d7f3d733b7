package com.dcruver.flowscript.exception;

import java.util.Map;

public class NodeNotFoundException extends QueryException {
    public NodeNotFoundException(String nodeId) {
        super(ErrorCode.NOT_FOUND, "Node not found: " + nodeId, Map.of("nodeId", nodeId));
    }
}
