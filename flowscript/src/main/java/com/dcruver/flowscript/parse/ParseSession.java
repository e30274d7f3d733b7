package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.exception.ParseException;
import com.dcruver.flowscript.ir.Modifier;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.RelationType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive descent over the token list of one document. Holds all per-parse state,
 * so every parse starts from nothing.
 *
 * <pre>
 * document   := statements EOF
 * group      := '{' statements '}'
 * statement  := prefix* ( relOp operand relTail* | element relTail* | ε )
 * element    := MARKER TEXT? group? | group | TEXT group?
 * operand    := prefix* element
 * relTail    := relOp operand
 * </pre>
 */
class ParseSession {

    private final List<Token> tokens;
    private final ScanResult scan;
    private final String sourceFile;
    private final GraphAssembler assembler;
    private final boolean requireTensionAxis;

    /** Standalone state markers waiting for the next node */
    private final List<Token> pendingStates = new ArrayList<>();

    private int pos;

    ParseSession(List<Token> tokens, ScanResult scan, String sourceFile,
                 GraphAssembler assembler, boolean requireTensionAxis) {
        this.tokens = tokens;
        this.scan = scan;
        this.sourceFile = sourceFile;
        this.assembler = assembler;
        this.requireTensionAxis = requireTensionAxis;
    }

    void parseDocument() {
        parseStatements(new Scope(null), null);
        if (!peek().is(TokenType.EOF)) {
            throw error(peek(), "Unexpected " + peek().describe());
        }
        if (!pendingStates.isEmpty()) {
            Token state = pendingStates.get(0);
            throw error(state, "State marker " + state.getText() + " is not followed by a node");
        }
    }

    /**
     * Statements until the closing brace of {@code open}, or until EOF at top level
     */
    private void parseStatements(Scope scope, Token open) {
        while (true) {
            skipSeparators();
            Token t = peek();
            if (t.is(TokenType.EOF)) {
                if (open != null) {
                    throw error(open, "Unterminated group: missing '}'");
                }
                return;
            }
            if (t.is(TokenType.RBRACE)) {
                if (open != null) {
                    return;
                }
                throw error(t, "Unexpected '}' without a matching '{'");
            }

            parseStatement(scope);

            Token after = peek();
            if (!after.getType().endsStatement()) {
                throw error(after, "Unexpected " + after.describe());
            }
        }
    }

    private void parseStatement(Scope scope) {
        Prefix prefix = parsePrefix();
        Token t = peek();

        if (t.getType().isRelationOperator()) {
            if (!prefix.modifiers.isEmpty()) {
                throw error(prefix.first, "Modifier " + prefix.first.getText() + " must be followed by a node");
            }
            pendingStates.addAll(prefix.states);
            String source = scope.owner != null ? scope.owner : scope.leading;
            if (source == null) {
                throw error(t, "Relation '" + t.getText() + "' has no source node");
            }
            scope.lastLeader = parseRelationTails(scope, source);
            return;
        }

        if (startsElement(t)) {
            if (t.is(TokenType.LBRACE) && prefix.isEmpty() && scope.lastLeader != null && groupEndsStatement()) {
                parseBody(scope.lastLeader);
                return;
            }
            String leader = parseElement(scope, prefix);
            registerLeader(scope, leader, t);
            parseRelationTails(scope, leader);
            return;
        }

        if (!prefix.modifiers.isEmpty()) {
            throw error(prefix.first, "Modifier " + prefix.first.getText() + " must be followed by a node");
        }
        if (prefix.states.isEmpty()) {
            throw error(t, "Unexpected " + t.describe());
        }
        pendingStates.addAll(prefix.states);
    }

    /**
     * Returns the first target, or null when no operator follows
     */
    private String parseRelationTails(Scope scope, String source) {
        String first = null;
        String current = source;
        while (peek().getType().isRelationOperator()) {
            Token op = next();
            Prefix prefix = parsePrefix();
            if (!startsElement(peek())) {
                throw error(op, "Relation '" + op.getText() + "' is missing its target");
            }
            String target = parseElement(scope, prefix);
            link(op, current, target);
            if (first == null) {
                first = target;
            }
            current = target;
        }
        return first;
    }

    private void link(Token op, String left, String right) {
        int line = op.getLine();
        switch (op.getType()) {
            case CAUSES:
                assembler.addRelationship(RelationType.CAUSES, left, right, null, false, line);
                break;
            case DERIVES_FROM:
                assembler.addRelationship(RelationType.DERIVES_FROM, right, left, null, false, line);
                break;
            case BIDIRECTIONAL:
                assembler.addRelationship(RelationType.BIDIRECTIONAL, left, right, null, true, line);
                break;
            case TEMPORAL:
                assembler.addRelationship(RelationType.TEMPORAL, left, right, null, false, line);
                break;
            case TENSION:
                if (op.getAxisLabel() == null && requireTensionAxis) {
                    throw error(op, "Tension operator '><' requires an axis label: ><[dimension of tradeoff]");
                }
                assembler.addRelationship(RelationType.TENSION, left, right, op.getAxisLabel(), false, line);
                break;
            case EQUIVALENT:
                assembler.addRelationship(RelationType.EQUIVALENT, left, right, null, false, line);
                break;
            case DIFFERENT:
                assembler.addRelationship(RelationType.DIFFERENT, left, right, null, false, line);
                break;
            default:
                throw error(op, "Unexpected " + op.describe());
        }
    }

    private String parseElement(Scope scope, Prefix prefix) {
        Token t = next();
        switch (t.getType()) {
            case MARKER: {
                Token text = peek().is(TokenType.TEXT) ? next() : null;
                if (text != null) {
                    String id = createNode(scope, t.getNodeType(), text.getText(), prefix, t);
                    if (peek().is(TokenType.LBRACE)) {
                        parseBody(id);
                    }
                    return id;
                }
                if (!peek().is(TokenType.LBRACE)) {
                    throw error(t, "Marker '" + t.getText() + "' must be followed by content");
                }
                Group group = parseAnonymousGroup();
                String id = createNode(scope, t.getNodeType(), group.summary(), prefix, t);
                assembler.addChildren(id, group.members);
                return id;
            }
            case TEXT: {
                String id = createNode(scope, NodeType.STATEMENT, t.getText(), prefix, t);
                if (peek().is(TokenType.LBRACE)) {
                    parseBody(id);
                }
                return id;
            }
            case LBRACE: {
                pos--;
                Group group = parseAnonymousGroup();
                String id = createNode(scope, NodeType.BLOCK, group.summary(), prefix, t);
                assembler.addChildren(id, group.members);
                return id;
            }
            default:
                throw error(t, "Expected a node but found " + t.describe());
        }
    }

    /**
     * Group owned by an existing node; its direct nodes become the owner's children
     */
    private void parseBody(String ownerId) {
        Token open = expect(TokenType.LBRACE);
        Scope inner = new Scope(ownerId);
        parseStatements(inner, open);
        expect(TokenType.RBRACE);
        assembler.addChildren(ownerId, inner.members);
    }

    private Group parseAnonymousGroup() {
        Token open = expect(TokenType.LBRACE);
        Scope inner = new Scope(null);
        parseStatements(inner, open);
        expect(TokenType.RBRACE);
        return new Group(inner.members);
    }

    private String createNode(Scope scope, NodeType type, String content, Prefix prefix, Token at) {
        String id = assembler.addNode(type, content, prefix.modifiers, at.getLine());
        if (!id.equals(scope.owner)) {
            scope.members.add(id);
        }
        for (Token state : prefix.states) {
            assembler.addState(state.getStateType(), id, state.getFields(), state.getLine());
        }
        for (Token state : pendingStates) {
            assembler.addState(state.getStateType(), id, state.getFields(), state.getLine());
        }
        pendingStates.clear();
        return id;
    }

    private void registerLeader(Scope scope, String id, Token at) {
        if (scope.leading == null) {
            scope.leading = id;
        }
        scope.lastLeader = id;

        NodeType type = assembler.typeOf(id);
        if (type == NodeType.QUESTION) {
            scope.lastQuestion = id;
        } else if (type == NodeType.ALTERNATIVE) {
            String question = scope.lastQuestion;
            if (question == null && scope.owner != null && assembler.typeOf(scope.owner) == NodeType.QUESTION) {
                question = scope.owner;
            }
            if (question != null) {
                assembler.addRelationship(RelationType.ALTERNATIVE, question, id, null, false, at.getLine());
                assembler.addChildren(question, List.of(id));
            }
        }
    }

    private Prefix parsePrefix() {
        Prefix prefix = new Prefix();
        while (peek().is(TokenType.STATE) || peek().is(TokenType.MODIFIER)) {
            Token t = next();
            if (prefix.first == null) {
                prefix.first = t;
            }
            if (t.is(TokenType.STATE)) {
                prefix.states.add(t);
            } else {
                prefix.modifiers.add(t.getModifier());
            }
        }
        return prefix;
    }

    /**
     * Lookahead: does the group starting at the current token close the statement?
     */
    private boolean groupEndsStatement() {
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).getType();
            if (type == TokenType.LBRACE) {
                depth++;
            } else if (type == TokenType.RBRACE) {
                depth--;
                if (depth == 0) {
                    return i + 1 >= tokens.size() || tokens.get(i + 1).getType().endsStatement();
                }
            }
        }
        return true;
    }

    private static boolean startsElement(Token t) {
        return t.is(TokenType.MARKER) || t.is(TokenType.TEXT) || t.is(TokenType.LBRACE);
    }

    private void skipSeparators() {
        while (peek().is(TokenType.NEWLINE) || peek().is(TokenType.SEPARATOR)) {
            pos++;
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) {
            pos++;
        }
        return t;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (!t.is(type)) {
            throw error(t, "Expected '" + type.symbol() + "' but found " + t.describe());
        }
        return next();
    }

    private ParseException error(Token at, String detail) {
        return new ParseException(detail, sourceFile, scan.originalLine(at.getLine()));
    }

    /** Parsing state of one brace group, or of the document */
    private static final class Scope {
        private final String owner;
        private final Set<String> members = new LinkedHashSet<>();
        private String leading;
        private String lastLeader;
        private String lastQuestion;

        private Scope(String owner) {
            this.owner = owner;
        }
    }

    private static final class Prefix {
        private final List<Token> states = new ArrayList<>();
        private final Set<Modifier> modifiers = new LinkedHashSet<>();
        private Token first;

        private boolean isEmpty() {
            return first == null;
        }
    }

    private final class Group {
        private final Set<String> members;

        private Group(Set<String> members) {
            this.members = members;
        }

        private String summary() {
            return members.stream()
                .map(assembler::contentOf)
                .collect(Collectors.joining("; ", "{", "}"));
        }
    }
}
