package com.dcruver.flowscript.exception;

import java.util.List;
import java.util.Map;

/**
 * A serialized graph could not be read, or violates structural invariants.
 */
public class SchemaException extends FlowScriptException {
    private final List<String> violations;

    public SchemaException(String message, Throwable cause) {
        super(ErrorCode.SCHEMA, message, cause);
        this.violations = List.of(message);
    }

    public SchemaException(List<String> violations) {
        super(ErrorCode.SCHEMA,
            "IR failed schema validation: " + String.join("; ", violations),
            Map.of("violations", violations.size()));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
