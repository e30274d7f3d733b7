package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.ir.Modifier;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.StateType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One lexical token. {@code line} is a line of the preprocessed text.
 */
@Value
@Builder
class Token {
    TokenType type;
    String text;
    int line;

    /** MARKER tokens */
    NodeType nodeType;

    /** MODIFIER tokens */
    Modifier modifier;

    /** STATE tokens */
    StateType stateType;
    Map<String, String> fields;

    /** TENSION tokens; null when no label was written */
    String axisLabel;

    boolean is(TokenType tokenType) {
        return type == tokenType;
    }

    String describe() {
        switch (type) {
            case NEWLINE:
                return "end of line";
            case EOF:
                return "end of input";
            default:
                return "'" + text + "'";
        }
    }
}
