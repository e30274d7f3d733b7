package com.dcruver.flowscript.exception;

/** Grammar mismatch; always fails the whole document. */
public class ParseException extends LocatedException {
    public ParseException(String detail, String sourceFile, int line) {
        super(ErrorCode.PARSE, detail, sourceFile, line);
    }
}
