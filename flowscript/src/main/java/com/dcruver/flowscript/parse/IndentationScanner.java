package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.exception.IndentationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites indentation-based nesting into explicit braces.
 *
 * <p>An indented line gets a {@code &#123;} prefixed to its content; every level closed by a
 * dedent becomes its own {@code &#125;} line, credited to the dedenting line. Levels still
 * open at the end are closed on lines credited to the last non-blank line. Inside an
 * explicit brace group opened on an earlier line, indentation is free-form and lines pass
 * through untouched.
 */
@Slf4j
public class IndentationScanner {

    public static final int DEFAULT_INDENT_UNIT = 2;

    private final int indentUnit;

    public IndentationScanner() {
        this(DEFAULT_INDENT_UNIT);
    }

    public IndentationScanner(int indentUnit) {
        if (indentUnit < 1) {
            throw new IllegalArgumentException("Indent unit must be positive: " + indentUnit);
        }
        this.indentUnit = indentUnit;
    }

    public ScanResult process(String text) {
        return process(text, null);
    }

    /**
     * Preprocess {@code text}; {@code sourceFile} is only used to locate errors
     */
    public ScanResult process(String text, String sourceFile) {
        String[] lines = text.split("\r?\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        List<Integer> lineMap = new ArrayList<>(lines.length);

        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        boolean seenContent = false;
        int braceDepth = 0;
        int lastNonBlank = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNo = i + 1;

            if (line.isBlank()) {
                out.add(line);
                lineMap.add(lineNo);
                continue;
            }

            if (line.indexOf('\t') >= 0) {
                throw new IndentationException(
                    String.format("Tabs not allowed. Use %d spaces for indentation.", indentUnit),
                    sourceFile, lineNo);
            }

            if (braceDepth > 0) {
                out.add(line);
                lineMap.add(lineNo);
                braceDepth = Math.max(0, braceDepth + braceDelta(line));
                lastNonBlank = lineNo;
                continue;
            }

            int indent = leadingSpaces(line);
            if (!seenContent && indent > 0) {
                throw new IndentationException("First line cannot be indented.", sourceFile, lineNo);
            }
            seenContent = true;

            if (indent % indentUnit != 0) {
                throw new IndentationException(
                    String.format("Indentation must be a multiple of %d spaces (found %d).", indentUnit, indent),
                    sourceFile, lineNo);
            }

            String content = line.substring(indent);
            int opened = braceDelta(content);
            int top = stack.peek();

            if (indent > top) {
                stack.push(indent);
                content = "{" + content;
            } else if (indent < top) {
                if (!stack.contains(indent)) {
                    List<Integer> expected = new ArrayList<>(stack);
                    Collections.reverse(expected);
                    throw new IndentationException(
                        String.format("Invalid dedent to level %d. Expected one of: %s.", indent, expected),
                        sourceFile, lineNo);
                }
                while (stack.peek() > indent) {
                    stack.pop();
                    out.add("}");
                    lineMap.add(lineNo);
                }
            }

            out.add(content);
            lineMap.add(lineNo);
            braceDepth = Math.max(0, opened);
            lastNonBlank = lineNo;
        }

        int closingLine = lastNonBlank == 0 ? lines.length : lastNonBlank;
        while (stack.size() > 1) {
            stack.pop();
            out.add("}");
            lineMap.add(closingLine);
        }

        log.debug("Preprocessed {} source lines into {} lines", lines.length, out.size());
        return new ScanResult(String.join("\n", out), lineMap);
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    /**
     * Net braces opened by a line, ignoring quoted strings and bracketed labels or states
     */
    static int braceDelta(String line) {
        int delta = 0;
        boolean inQuote = false;
        int bracketDepth = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuote) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inQuote = false;
                }
            } else if (c == '"' && bracketDepth > 0) {
                inQuote = true;
            } else if (c == '[') {
                bracketDepth++;
            } else if (c == ']' && bracketDepth > 0) {
                bracketDepth--;
            } else if (bracketDepth == 0 && c == '{') {
                delta++;
            } else if (bracketDepth == 0 && c == '}') {
                delta--;
            }
        }
        return delta;
    }
}
