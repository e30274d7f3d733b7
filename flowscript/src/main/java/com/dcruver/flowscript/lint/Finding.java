package com.dcruver.flowscript.lint;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One lint result. Findings are values; the linter never throws them.
 */
@Value
@Builder
public class Finding {
    Severity severity;

    /** Stable rule code, e.g. E001 */
    String code;

    String rule;
    String message;
    SourceLocation location;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    String suggestion;

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
