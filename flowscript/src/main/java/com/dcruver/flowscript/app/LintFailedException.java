package com.dcruver.flowscript.app;

/**
 * Raised by lint commands when ERROR findings exist. The message is the rendered report.
 */
public class LintFailedException extends RuntimeException {
    private final long errorCount;

    public LintFailedException(String report, long errorCount) {
        super(report);
        this.errorCount = errorCount;
    }

    public long getErrorCount() {
        return errorCount;
    }
}
