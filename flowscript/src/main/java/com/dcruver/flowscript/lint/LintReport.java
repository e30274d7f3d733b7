package com.dcruver.flowscript.lint;

import lombok.Value;

import java.util.List;

/**
 * All findings of one lint run, errors first, then by line.
 */
@Value
public class LintReport {
    List<Finding> findings;

    public LintReport(List<Finding> findings) {
        this.findings = List.copyOf(findings);
    }

    public long getErrorCount() {
        return findings.stream().filter(Finding::isError).count();
    }

    public long getWarningCount() {
        return findings.size() - getErrorCount();
    }

    /** No ERROR findings; warnings do not block */
    public boolean isClean() {
        return getErrorCount() == 0;
    }

    public boolean hasCode(String code) {
        return findings.stream().anyMatch(f -> f.getCode().equals(code));
    }

    public List<Finding> withCode(String code) {
        return findings.stream().filter(f -> f.getCode().equals(code)).toList();
    }
}
