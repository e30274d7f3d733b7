package com.dcruver.flowscript.exception;

/**
 * Stable error codes for FlowScript failures.
 * Suitable for logs and for mapping to process exit codes.
 */
public enum ErrorCode {
    /** Tab use, inconsistent spacing, invalid dedent, indented first line */
    INDENTATION,

    /** Grammar mismatch in the preprocessed source */
    PARSE,

    /** A deserialized graph violates structural invariants */
    SCHEMA,

    /** A query referenced an id that is not in the graph */
    NOT_FOUND,

    /** A query targeted a node of the wrong type */
    INVALID_NODE_TYPE,

    /** The graph handed to the query engine is inconsistent */
    INVALID_IR,

    /** Reading or writing files */
    IO_ERROR
}
