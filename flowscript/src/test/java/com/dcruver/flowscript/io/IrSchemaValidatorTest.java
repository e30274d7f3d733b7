package com.dcruver.flowscript.io;

import com.dcruver.flowscript.exception.SchemaException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.parse.FlowScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrSchemaValidatorTest {

    private IrSchemaValidator validator;
    private FlowGraph graph;

    @BeforeEach
    void setUp() {
        validator = new IrSchemaValidator();
        graph = new FlowScriptParser().parse("? which cache\n  || redis\n    ><[cost vs speed] memcached", "cache.fs");
    }

    @Test
    void testParsedGraphIsValid() {
        ValidationResult result = validator.validate(graph);

        assertTrue(result.isValid(), () -> String.join("\n", result.getViolations()));
        assertSame(graph, validator.requireValid(graph));
    }

    @Test
    void testTamperedContentBreaksHash() {
        List<Node> nodes = new ArrayList<>(graph.getNodes());
        nodes.set(0, nodes.get(0).toBuilder().content("which database").build());
        FlowGraph tampered = graph.toBuilder().clearNodes().nodes(nodes).build();

        ValidationResult result = validator.validate(tampered);

        assertFalse(result.isValid());
        assertTrue(result.getViolations().get(0).contains("does not match the hash"));
    }

    @Test
    void testDanglingReferences() {
        Node orphanParent = graph.getNodes().get(0).toBuilder().child("missing-child").build();
        Relationship dangling = graph.getRelationships().get(0).toBuilder().target("missing-node").build();
        FlowGraph broken = graph.toBuilder()
            .clearNodes().node(orphanParent).nodes(graph.getNodes().subList(1, graph.getNodes().size()))
            .clearRelationships().relationship(dangling)
            .build();

        List<String> violations = validator.validate(broken).getViolations();

        assertTrue(violations.stream().anyMatch(v -> v.contains("unknown child missing-child")));
        assertTrue(violations.stream().anyMatch(v -> v.contains("unknown target missing-node")));
    }

    @Test
    void testAxisLabelOnlyOnTension() {
        Relationship alternative = graph.getRelationships().get(0);
        Relationship labeled = alternative.toBuilder().axisLabel("cost").build();
        FlowGraph broken = graph.toBuilder().clearRelationships().relationship(labeled).build();

        List<String> violations = validator.validate(broken).getViolations();

        assertTrue(violations.stream().anyMatch(v -> v.contains("carries an axis label")));
    }

    @Test
    void testMissingBlocksAndUnsupportedVersion() {
        FlowGraph broken = graph.toBuilder().version("2.0.0").metadata(null).invariants(null).build();

        SchemaException e = assertThrows(SchemaException.class, () -> validator.requireValid(broken));

        assertEquals(3, e.getViolations().size());
        assertTrue(e.getViolations().contains("Unsupported IR version: 2.0.0"));
        assertTrue(e.getViolations().contains("Missing metadata block"));
        assertTrue(e.getViolations().contains("Missing invariants block"));
    }

    @Test
    void testIncompleteProvenance() {
        Node first = graph.getNodes().get(0);
        Node noLine = first.toBuilder().provenance(first.getProvenance().withLineNumber(0)).build();
        List<Node> nodes = new ArrayList<>(graph.getNodes());
        nodes.set(0, noLine);
        FlowGraph broken = graph.toBuilder().clearNodes().nodes(nodes).build();

        List<String> violations = validator.validate(broken).getViolations();

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).endsWith("provenance line_number must be at least 1"));
    }
}
