package com.dcruver.flowscript.lint;

import com.dcruver.flowscript.ir.Provenance;

/**
 * Base for rules: fixed identity plus a finding factory.
 */
public abstract class AbstractLintRule implements LintRule {

    private static final int MAX_QUOTED_LENGTH = 50;

    private final String code;
    private final String name;
    private final String description;
    private final Severity severity;

    protected AbstractLintRule(String code, String name, String description, Severity severity) {
        this.code = code;
        this.name = name;
        this.description = description;
        this.severity = severity;
    }

    @Override
    public String getCode() {
        return code;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Severity getSeverity() {
        return severity;
    }

    protected Finding finding(String message, Provenance at, String suggestion) {
        return Finding.builder()
            .severity(severity)
            .code(code)
            .rule(name)
            .message(message)
            .location(SourceLocation.of(at))
            .suggestion(suggestion)
            .build();
    }

    /** Node content in quotes, shortened for messages */
    protected static String quote(String content) {
        String text = content == null ? "" : content;
        if (text.length() > MAX_QUOTED_LENGTH) {
            text = text.substring(0, MAX_QUOTED_LENGTH - 3) + "...";
        }
        return "\"" + text + "\"";
    }
}
