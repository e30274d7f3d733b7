package com.dcruver.flowscript.io;

import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {
    List<String> violations;

    public ValidationResult(List<String> violations) {
        this.violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
