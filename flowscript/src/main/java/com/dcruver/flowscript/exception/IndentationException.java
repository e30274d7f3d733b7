package com.dcruver.flowscript.exception;

/** Tabs, spacing that is not a multiple of the unit, invalid dedents, an indented first line. */
public class IndentationException extends LocatedException {
    public IndentationException(String detail, String sourceFile, int line) {
        super(ErrorCode.INDENTATION, detail, sourceFile, line);
    }
}
