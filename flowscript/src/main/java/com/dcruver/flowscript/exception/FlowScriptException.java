package com.dcruver.flowscript.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the FlowScript toolchain.
 * Carries a stable {@link ErrorCode} and an unmodifiable context map.
 */
public class FlowScriptException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> context;

    public FlowScriptException(ErrorCode code, String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public FlowScriptException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Collections.emptyMap(), cause);
    }

    public FlowScriptException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public FlowScriptException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    /** Additional key/value details that help locate the failure */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach((k, v) -> {
            if (v != null) {
                m.put(k, v);
            }
        });
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + ", message=" + getMessage()
            + (context.isEmpty() ? "" : ", context=" + context)
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
