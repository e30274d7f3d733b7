package com.dcruver.flowscript.io;

import com.dcruver.flowscript.exception.SchemaException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.parse.FlowScriptParser;
import com.dcruver.flowscript.parse.ParserProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Writing a compiled graph and reading it back must reproduce it exactly.
 */
class IrJsonCodecRoundTripTest {

    private IrJsonCodec codec;
    private FlowScriptParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        codec = new IrJsonCodec();
        parser = new FlowScriptParser(new ParserProperties(),
            Clock.fixed(Instant.parse("2025-10-20T09:30:00.123456Z"), ZoneOffset.UTC));
    }

    private FlowGraph decisionGraph() throws Exception {
        return parser.parseFile(Path.of(getClass().getResource("/examples/decision.fs").toURI()));
    }

    @Test
    void testRoundTripPreservesGraph() throws Exception {
        FlowGraph graph = decisionGraph();

        Path output = tempDir.resolve("out/decision.json");
        codec.write(graph, output, true);
        FlowGraph restored = codec.read(output);

        assertEquals(graph, restored);
        assertTrue(new IrSchemaValidator().validate(restored).isValid());
        assertTrue(Files.readString(output).endsWith("\n"), "Pretty output should end with newline");
    }

    @Test
    void testWireFormatUsesSnakeCaseAndLowercaseTypes() throws Exception {
        String json = codec.toJson(decisionGraph(), false);

        assertTrue(json.contains("\"type\":\"question\""));
        assertTrue(json.contains("\"type\":\"derives_from\"") || json.contains("\"type\":\"causes\""));
        assertTrue(json.contains("\"axis_label\":\"security vs simplicity\""));
        assertTrue(json.contains("\"node_id\":"));
        assertTrue(json.contains("\"line_number\":"));
        assertTrue(json.contains("\"source_file\":\"decision.fs\""));
        assertTrue(json.contains("\"parsed_at\":\"2025-10-20T09:30:00.123456Z\""));
        assertTrue(json.contains("\"modifiers\":[\"high_confidence\"]"));
        assertTrue(json.contains("\"causal_acyclic\":true"));
        assertFalse(json.contains("\"ext\""), "Empty extension maps are omitted");
        assertFalse(json.contains("\"axis_label\":null"));
    }

    @Test
    void testCompactOutputIsSingleLine() throws Exception {
        String json = codec.toJson(decisionGraph(), false);

        assertFalse(json.contains("\n"));
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        String json = codec.toJson(decisionGraph(), false);
        String extended = "{\"x_future_field\":42," + json.substring(1);

        assertEquals(decisionGraph(), codec.fromJson(extended));
    }

    @Test
    void testMalformedJsonIsSchemaError() {
        SchemaException e = assertThrows(SchemaException.class, () -> codec.fromJson("{\"nodes\": [}"));

        assertTrue(e.getMessage().startsWith("Malformed IR document"));
    }
}
