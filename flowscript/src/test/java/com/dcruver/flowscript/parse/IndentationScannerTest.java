package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.exception.IndentationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndentationScannerTest {

    private IndentationScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new IndentationScanner();
    }

    @Test
    void testFlatTextPassesThrough() {
        ScanResult result = scanner.process("A -> B\nC -> D");

        assertEquals("A -> B\nC -> D", result.getText());
        assertEquals(List.of(1, 2), result.getLineMap());
    }

    @Test
    void testIndentOpensAndDedentClosesGroups() {
        String source = """
            parent
              child
                grandchild
            sibling""";

        ScanResult result = scanner.process(source);

        assertEquals("parent\n{child\n{grandchild\n}\n}\nsibling", result.getText());
        // both closing braces belong to the dedenting line
        assertEquals(List.of(1, 2, 3, 4, 4, 4), result.getLineMap());
    }

    @Test
    void testOpenLevelsCloseAtEndOfInput() {
        String source = "parent\n  child\n    grandchild\n\n";

        ScanResult result = scanner.process(source);

        assertTrue(result.getText().endsWith("}\n}"));
        int last = result.transformedLineCount();
        assertEquals(3, result.originalLine(last));
        assertEquals(3, result.originalLine(last - 1));
    }

    @Test
    void testBlankLineWithTabIsKept() {
        ScanResult result = scanner.process("a\n\t\nb");

        assertEquals("a\n\t\nb", result.getText());
        assertEquals(List.of(1, 2, 3), result.getLineMap());
    }

    @Test
    void testBlankLinesAreKept() {
        ScanResult result = scanner.process("a\n\n  b");

        assertEquals("a\n\n{b\n}", result.getText());
        assertEquals(List.of(1, 2, 3, 3), result.getLineMap());
    }

    @Test
    void testTabIsRejected() {
        IndentationException e = assertThrows(IndentationException.class,
            () -> scanner.process("a\n\tb", "notes.fs"));

        assertEquals(2, e.getLine());
        assertEquals("notes.fs", e.getSourceFile());
        assertEquals("Tabs not allowed. Use 2 spaces for indentation.", e.getDetail());
    }

    @Test
    void testIndentedFirstLineIsRejected() {
        IndentationException e = assertThrows(IndentationException.class,
            () -> scanner.process("\n  a\nb"));

        assertEquals(2, e.getLine());
        assertEquals("First line cannot be indented.", e.getDetail());
    }

    @Test
    void testIndentMustBeMultipleOfUnit() {
        IndentationException e = assertThrows(IndentationException.class,
            () -> scanner.process("a\n   b"));

        assertEquals(2, e.getLine());
        assertEquals("Indentation must be a multiple of 2 spaces (found 3).", e.getDetail());
    }

    @Test
    void testDedentMustMatchAnOpenLevel() {
        String source = "a\n    b\n  c";

        IndentationException e = assertThrows(IndentationException.class, () -> scanner.process(source));

        assertEquals(3, e.getLine());
        assertEquals("Invalid dedent to level 2. Expected one of: [0, 4].", e.getDetail());
    }

    @Test
    void testExplicitBraceGroupIsFreeForm() {
        String source = "a {\n      b\n   c\n}\nd";

        ScanResult result = scanner.process(source);

        assertEquals(source, result.getText());
    }

    @Test
    void testBracesInsideLabelsDoNotOpenGroups() {
        String source = "a ><[cost {est}] b\n  c";

        ScanResult result = scanner.process(source);

        assertEquals("a ><[cost {est}] b\n{c\n}", result.getText());
    }

    @Test
    void testCustomIndentUnit() {
        ScanResult result = new IndentationScanner(4).process("a\n    b");

        assertEquals("a\n{b\n}", result.getText());
        assertThrows(IndentationException.class, () -> new IndentationScanner(4).process("a\n  b"));
    }

    @Test
    void testErrorMessageIncludesLocation() {
        IndentationException e = assertThrows(IndentationException.class,
            () -> scanner.process("a\n\tb", "notes.fs"));

        assertTrue(e.getMessage().startsWith("notes.fs:2:"));
    }
}
