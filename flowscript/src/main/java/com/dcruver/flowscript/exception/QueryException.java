package com.dcruver.flowscript.exception;

import java.util.Map;

/**
 * Failure of a single query call. Never alters engine state.
 */
public abstract class QueryException extends FlowScriptException {
    protected QueryException(ErrorCode code, String message, Map<String, ?> context) {
        super(code, message, context);
    }
}
