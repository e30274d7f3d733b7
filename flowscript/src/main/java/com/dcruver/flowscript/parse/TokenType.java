package com.dcruver.flowscript.parse;

/**
 * Lexical categories of the FlowScript grammar.
 */
enum TokenType {
    TEXT,

    // relation and definition operators
    CAUSES("->"),
    DERIVES_FROM("<-"),
    BIDIRECTIONAL("<->"),
    TEMPORAL("=>"),
    TENSION("><"),
    EQUIVALENT("="),
    DIFFERENT("!="),

    // element-start only
    MARKER,
    MODIFIER,
    STATE,

    LBRACE("{"),
    RBRACE("}"),
    SEPARATOR(";"),
    NEWLINE,
    EOF;

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    String symbol() {
        return symbol;
    }

    boolean isRelationOperator() {
        switch (this) {
            case CAUSES:
            case DERIVES_FROM:
            case BIDIRECTIONAL:
            case TEMPORAL:
            case TENSION:
            case EQUIVALENT:
            case DIFFERENT:
                return true;
            default:
                return false;
        }
    }

    boolean endsStatement() {
        return this == NEWLINE || this == SEPARATOR || this == RBRACE || this == EOF;
    }
}
