package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.exception.ParseException;
import com.dcruver.flowscript.ir.Modifier;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.StateType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits preprocessed FlowScript into tokens.
 *
 * <p>Relation operators are recognized anywhere. State markers, modifiers and content
 * markers are recognized only where an element may start: at the start of a line, after a
 * brace, a separator, an operator, a state marker or a modifier. Everything else is text.
 */
class FlowScriptLexer {

    private static final Pattern STATE_START = Pattern.compile("\\[(decided|blocked|exploring|parking)\\s*[(\\]]");
    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    /** Longest operators first so {@code <->} wins over {@code <-} */
    private static final TokenType[] OPERATORS = {
        TokenType.BIDIRECTIONAL,
        TokenType.CAUSES,
        TokenType.DERIVES_FROM,
        TokenType.TEMPORAL,
        TokenType.TENSION,
        TokenType.DIFFERENT,
        TokenType.EQUIVALENT
    };

    private final String input;
    private final ScanResult scan;
    private final String sourceFile;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int groupDepth;
    private boolean elementStart = true;

    FlowScriptLexer(ScanResult scan, String sourceFile) {
        this.input = scan.getText();
        this.scan = scan;
        this.sourceFile = sourceFile;
    }

    List<Token> tokenize() {
        while (pos < input.length()) {
            char c = input.charAt(pos);

            if (c == '\n') {
                emit(TokenType.NEWLINE, "\n");
                pos++;
                line++;
                elementStart = true;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '{') {
                emit(TokenType.LBRACE, "{");
                pos++;
                groupDepth++;
                elementStart = true;
            } else if (c == '}') {
                emit(TokenType.RBRACE, "}");
                pos++;
                groupDepth = Math.max(0, groupDepth - 1);
                elementStart = true;
            } else if (c == ';' && groupDepth > 0) {
                emit(TokenType.SEPARATOR, ";");
                pos++;
                elementStart = true;
            } else if (operatorAt(pos) != null) {
                lexOperator(operatorAt(pos));
                elementStart = true;
            } else if (elementStart && lexElementStart()) {
                // state marker, modifier or content marker consumed
            } else {
                lexText();
                elementStart = false;
            }
        }
        emit(TokenType.EOF, "");
        return Collections.unmodifiableList(tokens);
    }

    private TokenType operatorAt(int at) {
        for (TokenType op : OPERATORS) {
            if (input.startsWith(op.symbol(), at)) {
                return op;
            }
        }
        return null;
    }

    private void lexOperator(TokenType op) {
        pos += op.symbol().length();
        if (op != TokenType.TENSION) {
            emit(op, op.symbol());
            return;
        }

        String axis = null;
        if (pos < input.length() && input.charAt(pos) == '[') {
            int close = indexOnLine(']', pos + 1);
            if (close < 0) {
                throw error("Unterminated axis label: expected ']' after '><['");
            }
            axis = input.substring(pos + 1, close).trim();
            if (axis.isEmpty()) {
                throw error("Tension axis label cannot be empty: write ><[dimension of tradeoff]");
            }
            pos = close + 1;
        }
        tokens.add(Token.builder()
            .type(TokenType.TENSION)
            .text(axis == null ? "><" : "><[" + axis + "]")
            .line(line)
            .axisLabel(axis)
            .build());
    }

    /**
     * Try the element-start-only tokens. Returns false when the input at {@code pos} is text.
     */
    private boolean lexElementStart() {
        if (input.charAt(pos) == '[') {
            Matcher m = STATE_START.matcher(input).region(pos, input.length());
            if (m.lookingAt()) {
                lexState(StateType.fromKeyword(m.group(1)), pos + 1 + m.group(1).length());
                return true;
            }
            return false;
        }

        if (input.startsWith("++", pos)) {
            return modifier(Modifier.STRONG_POSITIVE, "++");
        }
        if (input.startsWith("!", pos)) {
            return modifier(Modifier.URGENT, "!");
        }
        if (input.startsWith("*", pos)) {
            return modifier(Modifier.HIGH_CONFIDENCE, "*");
        }
        if (input.startsWith("~", pos)) {
            return modifier(Modifier.LOW_CONFIDENCE, "~");
        }

        if (input.startsWith("thought:", pos)) {
            return marker(NodeType.THOUGHT, "thought:");
        }
        if (input.startsWith("action:", pos)) {
            return marker(NodeType.ACTION, "action:");
        }
        if (input.startsWith("?", pos)) {
            return marker(NodeType.QUESTION, "?");
        }
        if (input.startsWith("✓", pos)) {
            return marker(NodeType.COMPLETION, "✓");
        }
        if (input.startsWith("||", pos)) {
            return marker(NodeType.ALTERNATIVE, "||");
        }
        return false;
    }

    private boolean modifier(Modifier modifier, String symbol) {
        tokens.add(Token.builder().type(TokenType.MODIFIER).text(symbol).line(line).modifier(modifier).build());
        pos += symbol.length();
        return true;
    }

    private boolean marker(NodeType nodeType, String symbol) {
        tokens.add(Token.builder().type(TokenType.MARKER).text(symbol).line(line).nodeType(nodeType).build());
        pos += symbol.length();
        elementStart = false;
        return true;
    }

    /**
     * {@code [keyword]} or {@code [keyword(name: "value", other: bare value)]}
     */
    private void lexState(StateType stateType, int afterKeyword) {
        int start = pos;
        pos = afterKeyword;
        skipSpaces();

        Map<String, String> fields = new LinkedHashMap<>();
        if (input.charAt(pos) == '(') {
            pos++;
            readFields(stateType, fields);
            skipSpaces();
        }

        if (pos >= input.length() || input.charAt(pos) != ']') {
            throw error("Malformed [" + stateType.wireName() + "] marker: expected ']'");
        }
        pos++;

        tokens.add(Token.builder()
            .type(TokenType.STATE)
            .text(input.substring(start, pos))
            .line(line)
            .stateType(stateType)
            .fields(Collections.unmodifiableMap(fields))
            .build());
    }

    private void readFields(StateType stateType, Map<String, String> fields) {
        String marker = "[" + stateType.wireName() + "]";
        skipSpaces();
        if (peekChar() == ')') {
            pos++;
            return;
        }

        while (true) {
            skipSpaces();
            Matcher name = FIELD_NAME.matcher(input).region(pos, input.length());
            if (!name.lookingAt()) {
                throw error("Malformed " + marker + " marker: expected a field name");
            }
            String fieldName = name.group();
            pos = name.end();
            skipSpaces();
            if (peekChar() != ':') {
                throw error("Malformed " + marker + " marker: expected ':' after field '" + fieldName + "'");
            }
            pos++;
            skipSpaces();

            String value = peekChar() == '"' ? readQuoted(fieldName) : readBare(fieldName);
            if (fields.put(fieldName, value) != null) {
                throw error("Malformed " + marker + " marker: duplicate field '" + fieldName + "'");
            }

            skipSpaces();
            char c = peekChar();
            if (c == ',') {
                pos++;
            } else if (c == ')') {
                pos++;
                return;
            } else {
                throw error("Malformed " + marker + " marker: expected ',' or ')' after field '" + fieldName + "'");
            }
        }
    }

    private String readQuoted(String fieldName) {
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                value.append(input.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '"') {
                pos++;
                return value.toString();
            }
            value.append(c);
            pos++;
        }
        throw error("Unterminated string in field '" + fieldName + "'");
    }

    private String readBare(String fieldName) {
        int start = pos;
        while (pos < input.length() && ",)\n]".indexOf(input.charAt(pos)) < 0) {
            pos++;
        }
        String value = input.substring(start, pos).trim();
        if (value.isEmpty()) {
            throw error("Field '" + fieldName + "' has no value");
        }
        return value;
    }

    private void lexText() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n' || c == '{' || c == '}' || (c == ';' && groupDepth > 0) || operatorAt(pos) != null) {
                break;
            }
            pos++;
        }
        String text = input.substring(start, pos).trim();
        if (!text.isEmpty()) {
            emit(TokenType.TEXT, text);
        }
    }

    private void emit(TokenType type, String text) {
        tokens.add(Token.builder().type(type).text(text).line(line).build());
    }

    private void skipSpaces() {
        while (pos < input.length() && input.charAt(pos) != '\n' && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private char peekChar() {
        return pos < input.length() ? input.charAt(pos) : '\0';
    }

    private int indexOnLine(char target, int from) {
        for (int i = from; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == target) {
                return i;
            }
            if (c == '\n') {
                return -1;
            }
        }
        return -1;
    }

    private ParseException error(String detail) {
        return new ParseException(detail, sourceFile, scan.originalLine(line));
    }
}
