package com.dcruver.flowscript.exception;

import java.util.Map;

/** The graph references ids it does not contain. */
public class InvalidIrException extends QueryException {
    public InvalidIrException(String message, String referencedId) {
        super(ErrorCode.INVALID_IR, message, Map.of("referencedId", referencedId));
    }
}
