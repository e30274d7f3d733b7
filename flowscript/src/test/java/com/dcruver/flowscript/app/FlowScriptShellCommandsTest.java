package com.dcruver.flowscript.app;

import com.dcruver.flowscript.exception.ErrorCode;
import com.dcruver.flowscript.exception.FlowScriptException;
import com.dcruver.flowscript.exception.SchemaException;
import com.dcruver.flowscript.io.IrJsonCodec;
import com.dcruver.flowscript.io.IrSchemaValidator;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.lint.CorpusLinter;
import com.dcruver.flowscript.lint.LinterProperties;
import com.dcruver.flowscript.lint.SemanticLinter;
import com.dcruver.flowscript.parse.FlowScriptParser;
import com.dcruver.flowscript.parse.ParserProperties;
import com.dcruver.flowscript.reporting.LintReportFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FlowScriptShellCommandsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-13T08:00:00Z"), ZoneOffset.UTC);

    private FlowScriptShellCommands commands;
    private FlowScriptParser parser;
    private IrJsonCodec codec;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new FlowScriptParser(new ParserProperties(), CLOCK);
        SemanticLinter linter = SemanticLinter.withDefaultRules(new LinterProperties());
        codec = new IrJsonCodec();
        commands = new FlowScriptShellCommands(parser, linter, new CorpusLinter(parser, linter), codec,
            new IrSchemaValidator(), new LintReportFormatter(), CLOCK);
    }

    private String example(String name) throws Exception {
        return Path.of(getClass().getResource("/examples/" + name).toURI()).toString();
    }

    private Path source(String name, String text) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Test
    void testParseWritesIrFile() throws Exception {
        Path output = tempDir.resolve("ir/decision.json");

        String message = commands.parse(example("decision.fs"), output.toString(), false);

        assertTrue(message.startsWith("✓ Parsed"));
        assertTrue(message.contains("11 nodes"));
        FlowGraph written = codec.read(output);
        assertEquals(parser.parseFile(Path.of(example("decision.fs"))), written);
    }

    @Test
    void testParsePrintsJsonWithoutOutput() throws Exception {
        String json = commands.parse(example("debug.fs"), null, true);

        assertTrue(json.contains("\"version\":\"1.0.0\""));
        assertFalse(json.contains("\n"));
    }

    @Test
    void testLintCleanFile() throws Exception {
        assertEquals("✓ decision.fs: No issues found\n", commands.lint(example("decision.fs"), false));
    }

    @Test
    void testLintFailureCarriesReport() throws Exception {
        Path file = source("tradeoff.fs", "speed >< quality\n");

        LintFailedException e = assertThrows(LintFailedException.class, () -> commands.lint(file.toString(), false));

        assertEquals(1, e.getErrorCount());
        assertTrue(e.getMessage().contains("ERROR: E001"));
        assertTrue(e.getMessage().contains("at tradeoff.fs:1"));
    }

    @Test
    void testLintJsonOutput() throws Exception {
        Path file = source("parked.fs", "[parking] migrate -> lower cost\n");

        String json = commands.lint(file.toString(), true);

        assertTrue(json.contains("\"code\" : \"W001\""));
        assertTrue(json.contains("\"severity\" : \"WARNING\""));
    }

    @Test
    void testLintAll() throws Exception {
        source("good.fs", "a -> b\n");
        source("bad.fs", "a -> b -> a\n");

        LintFailedException e = assertThrows(LintFailedException.class, () -> commands.lintAll(tempDir.toString()));

        assertTrue(e.getMessage().contains("✗ bad.fs: 1 error(s)"));
        assertTrue(e.getMessage().contains("✓ good.fs"));
        assertTrue(e.getMessage().contains("Files: 2"));
    }

    @Test
    void testValidateVerbose() throws Exception {
        Path ir = tempDir.resolve("decision.json");
        commands.parse(example("decision.fs"), ir.toString(), false);

        String result = commands.validate(ir.toString(), true);

        assertTrue(result.contains("is valid IR (version 1.0.0)"));
        assertTrue(result.contains("- Nodes: 11"));
        assertTrue(result.contains("- Causal graph acyclic: true"));
    }

    @Test
    void testValidateRejectsTamperedIr() throws Exception {
        Path ir = tempDir.resolve("decision.json");
        commands.parse(example("decision.fs"), ir.toString(), false);
        Files.writeString(ir, Files.readString(ir).replace("stateless auth", "stateful auth"));

        SchemaException e = assertThrows(SchemaException.class, () -> commands.validate(ir.toString(), false));

        assertEquals(1, e.getViolations().size());
    }

    @Test
    void testQueryWhyFromSourceByContent() throws Exception {
        String json = commands.why(example("debug.fs"), "timeout errors in production", null, "chain");

        assertTrue(json.contains("\"root_causes\""));
        assertTrue(json.contains("connection leak in user service"));
        assertTrue(json.contains("\"total_ancestors\" : 3"));
    }

    @Test
    void testQueryAlternativesFromIr() throws Exception {
        Path ir = tempDir.resolve("decision.json");
        commands.parse(example("decision.fs"), ir.toString(), false);

        String json = commands.alternatives(ir.toString(), "authentication strategy for v1 launch", "simple", false);

        assertTrue(json.contains("\"chosen\" : \"session tokens + Redis\""));
    }

    @Test
    void testQueryBlockedAndTensions() throws Exception {
        String blocked = commands.blocked(example("blocked.fs"), "2025-09-01", "summary");
        assertTrue(blocked.contains("\"impact_score\" : 17"));
        assertTrue(blocked.contains("\"priority\" : \"HIGH\""));

        String tensions = commands.tensions(example("decision.fs"), "axis", null, false, null);
        assertTrue(tensions.contains("\"total_tensions\" : 2"));

        String impact = commands.whatIf(example("debug.fs"), "connection leak in user service", null, "list", false);
        assertTrue(impact.contains("\"total_descendants\" : 2"));
    }

    @Test
    void testAmbiguousContentReference() throws Exception {
        FlowScriptException e = assertThrows(FlowScriptException.class,
            () -> commands.why(example("decision.fs"), "session tokens + Redis", null, "chain"));

        assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("matches 2 nodes"));
    }

    @Test
    void testBadOptionValues() throws Exception {
        String file = example("blocked.fs");

        assertThrows(IllegalArgumentException.class, () -> commands.blocked(file, "last week", "summary"));
        assertThrows(IllegalArgumentException.class, () -> commands.blocked(file, null, "verbose"));
    }

    @Test
    void testMissingFileIsIoError() {
        FlowScriptException e = assertThrows(FlowScriptException.class,
            () -> commands.lint(tempDir.resolve("absent.fs").toString(), false));

        assertEquals(ErrorCode.IO_ERROR, e.getCode());
    }
}
