package com.dcruver.flowscript.reporting;

import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.LintReport;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders lint results as plain text for the terminal.
 */
@Component
public class LintReportFormatter {

    /**
     * One block per finding, then a count line
     */
    public String format(String file, LintReport report) {
        if (report.getFindings().isEmpty()) {
            return String.format("✓ %s: No issues found\n", file);
        }

        StringBuilder sb = new StringBuilder();
        for (Finding finding : report.getFindings()) {
            sb.append(String.format("%s: %s - %s\n", finding.getSeverity(), finding.getCode(), finding.getMessage()));
            sb.append("  at ").append(finding.getLocation()).append("\n");
            if (finding.getSuggestion() != null) {
                sb.append("  Suggestion: ").append(finding.getSuggestion()).append("\n");
            }
            sb.append("\n");
        }
        sb.append(counts(report.getErrorCount(), report.getWarningCount())).append("\n");
        return sb.toString();
    }

    /**
     * Summary over many files: one line per file, then totals
     */
    public String formatSummary(Map<String, LintReport> reports) {
        StringBuilder sb = new StringBuilder();
        long errors = 0;
        long warnings = 0;

        for (Map.Entry<String, LintReport> entry : reports.entrySet()) {
            LintReport report = entry.getValue();
            errors += report.getErrorCount();
            warnings += report.getWarningCount();
            String mark = report.isClean() ? "✓" : "✗";
            sb.append(String.format("%s %s: %s\n", mark, entry.getKey(),
                counts(report.getErrorCount(), report.getWarningCount())));
        }

        sb.append(String.format("\nFiles: %d\n", reports.size()));
        sb.append("Total: ").append(counts(errors, warnings)).append("\n");
        return sb.toString();
    }

    private static String counts(long errors, long warnings) {
        return String.format("%d error(s), %d warning(s)", errors, warnings);
    }
}
