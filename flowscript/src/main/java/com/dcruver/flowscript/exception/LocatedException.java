package com.dcruver.flowscript.exception;

import java.util.Map;

/**
 * A fatal source error pinned to a file and an original (pre-preprocessing) line.
 */
public abstract class LocatedException extends FlowScriptException {
    private final String sourceFile;
    private final int line;
    private final String detail;

    protected LocatedException(ErrorCode code, String detail, String sourceFile, int line) {
        super(code, format(detail, sourceFile, line), Map.of(
            "file", sourceFile == null ? "<input>" : sourceFile,
            "line", line));
        this.sourceFile = sourceFile;
        this.line = line;
        this.detail = detail;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    /** Original 1-based source line */
    public int getLine() {
        return line;
    }

    /** Message without location */
    public String getDetail() {
        return detail;
    }

    private static String format(String detail, String sourceFile, int line) {
        String file = sourceFile == null ? "<input>" : sourceFile;
        return String.format("%s:%d: %s", file, line, detail);
    }
}
