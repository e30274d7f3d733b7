package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.exception.ParseException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Modifier;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.ir.StateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FlowScriptParserTest {

    private static final Instant NOW = Instant.parse("2025-10-20T09:30:00Z");

    private FlowScriptParser parser;

    @BeforeEach
    void setUp() {
        parser = new FlowScriptParser(new ParserProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Node node(FlowGraph graph, String content) {
        return graph.getNodes().stream()
            .filter(n -> n.getContent().equals(content))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No node with content: " + content));
    }

    private static List<Relationship> relationships(FlowGraph graph, RelationType type) {
        return graph.getRelationships().stream().filter(r -> r.is(type)).collect(Collectors.toList());
    }

    private static Path example(String name) throws Exception {
        return Path.of(FlowScriptParserTest.class.getResource("/examples/" + name).toURI());
    }

    @Test
    void testCausesEdge() {
        FlowGraph graph = parser.parse("slow queries -> timeouts", "a.fs");

        assertEquals(2, graph.getNodes().size());
        Relationship rel = graph.getRelationships().get(0);
        assertEquals(RelationType.CAUSES, rel.getType());
        assertEquals(node(graph, "slow queries").getId(), rel.getSource());
        assertEquals(node(graph, "timeouts").getId(), rel.getTarget());
        assertFalse(rel.isFeedback());
    }

    @Test
    void testDerivesFromPointsFromCauseToEffect() {
        FlowGraph graph = parser.parse("timeouts <- slow queries", "a.fs");

        Relationship rel = graph.getRelationships().get(0);
        assertEquals(RelationType.DERIVES_FROM, rel.getType());
        assertEquals(node(graph, "slow queries").getId(), rel.getSource());
        assertEquals(node(graph, "timeouts").getId(), rel.getTarget());
    }

    @Test
    void testBidirectionalIsFeedback() {
        FlowGraph graph = parser.parse("load <-> latency", "a.fs");

        Relationship rel = graph.getRelationships().get(0);
        assertEquals(RelationType.BIDIRECTIONAL, rel.getType());
        assertTrue(rel.isFeedback());
    }

    @Test
    void testChainLinksEachAdjacentPair() {
        FlowGraph graph = parser.parse("A -> B => C", "a.fs");

        List<Relationship> rels = graph.getRelationships();
        assertEquals(2, rels.size());
        assertEquals(RelationType.CAUSES, rels.get(0).getType());
        assertEquals(node(graph, "B").getId(), rels.get(1).getSource());
        assertEquals(RelationType.TEMPORAL, rels.get(1).getType());
        assertEquals(node(graph, "C").getId(), rels.get(1).getTarget());
    }

    @Test
    void testEquivalenceAndDifference() {
        FlowGraph graph = parser.parse("cache = memo table\ncache != database", "a.fs");

        assertEquals(1, relationships(graph, RelationType.EQUIVALENT).size());
        assertEquals(1, relationships(graph, RelationType.DIFFERENT).size());
    }

    @Test
    void testMarkersSetNodeType() {
        String source = """
            ? which database
              thought: postgres is familiar
              action: run benchmark
              ✓ schema drafted
            """;

        FlowGraph graph = parser.parse(source, "a.fs");

        assertEquals(NodeType.QUESTION, node(graph, "which database").getType());
        assertEquals(NodeType.THOUGHT, node(graph, "postgres is familiar").getType());
        assertEquals(NodeType.ACTION, node(graph, "run benchmark").getType());
        assertEquals(NodeType.COMPLETION, node(graph, "schema drafted").getType());
    }

    @Test
    void testIndentedLinesBecomeChildren() {
        String source = """
            release checklist
              update changelog
              tag version
            """;

        FlowGraph graph = parser.parse(source, "a.fs");

        Node parent = node(graph, "release checklist");
        assertEquals(List.of(node(graph, "update changelog").getId(), node(graph, "tag version").getId()),
            parent.getChildren());
        assertTrue(graph.getRelationships().isEmpty());
    }

    @Test
    void testContinuationLinesUseParentAsSource() throws Exception {
        FlowGraph graph = parser.parseFile(example("debug.fs"));

        String timeouts = node(graph, "timeout errors in production").getId();
        String pool = node(graph, "database connection pool exhausted").getId();
        String leak = node(graph, "connection leak in user service").getId();
        String traffic = node(graph, "traffic spike from marketing campaign").getId();

        List<Relationship> derived = relationships(graph, RelationType.DERIVES_FROM);
        assertEquals(3, derived.size());
        assertTrue(derived.stream().anyMatch(r -> r.getSource().equals(pool) && r.getTarget().equals(timeouts)));
        assertTrue(derived.stream().anyMatch(r -> r.getSource().equals(leak) && r.getTarget().equals(pool)));
        assertTrue(derived.stream().anyMatch(r -> r.getSource().equals(traffic) && r.getTarget().equals(timeouts)));

        assertEquals(Set.of(Modifier.URGENT), node(graph, "timeout errors in production").getModifiers());
        assertTrue(graph.getInvariants().isCausalAcyclic());
    }

    @Test
    void testAnonymousGroupBecomesBlockNode() {
        FlowGraph graph = parser.parse("{cpu spike; memory leak} -> outage", "a.fs");

        Node block = node(graph, "{cpu spike; memory leak}");
        assertEquals(NodeType.BLOCK, block.getType());
        assertEquals(2, block.getChildren().size());
        Relationship rel = graph.getRelationships().get(0);
        assertEquals(block.getId(), rel.getSource());
        assertEquals(node(graph, "outage").getId(), rel.getTarget());
    }

    @Test
    void testAlternativesLinkToQuestion() {
        String source = """
            ? which database
            || postgres
            || sqlite
            """;

        FlowGraph graph = parser.parse(source, "a.fs");

        Node question = node(graph, "which database");
        List<Relationship> alternatives = relationships(graph, RelationType.ALTERNATIVE);
        assertEquals(2, alternatives.size());
        assertTrue(alternatives.stream().allMatch(r -> r.getSource().equals(question.getId())));
        assertEquals(2, question.getChildren().size());
        assertEquals(NodeType.ALTERNATIVE, node(graph, "postgres").getType());
    }

    @Test
    void testDecisionDocument() throws Exception {
        FlowGraph graph = parser.parseFile(example("decision.fs"));

        assertEquals(11, graph.getNodes().size());
        assertEquals(7, graph.getRelationships().size());
        assertEquals(2, relationships(graph, RelationType.ALTERNATIVE).size());

        List<Relationship> tensions = relationships(graph, RelationType.TENSION);
        assertEquals(List.of("security vs simplicity", "performance vs security"),
            tensions.stream().map(Relationship::getAxisLabel).collect(Collectors.toList()));

        // the decided line is a plain statement sharing the alternative's content
        Node decided = graph.getNodes().stream()
            .filter(n -> n.getContent().equals("session tokens + Redis") && n.is(NodeType.STATEMENT))
            .findFirst()
            .orElseThrow();
        assertEquals(Set.of(Modifier.HIGH_CONFIDENCE), decided.getModifiers());
        assertEquals(2, decided.getChildren().size());

        State state = graph.getStates().get(0);
        assertEquals(StateType.DECIDED, state.getType());
        assertEquals(decided.getId(), state.getNodeId());
        assertEquals("security critical for v1", state.field("rationale"));
        assertEquals("2025-10-15", state.field("on"));
    }

    @Test
    void testProvenanceUsesOriginalLines() throws Exception {
        FlowGraph graph = parser.parseFile(example("decision.fs"));

        assertEquals(1, node(graph, "authentication strategy for v1 launch").getProvenance().getLineNumber());
        assertEquals(5, node(graph, "token revocation complexity").getProvenance().getLineNumber());
        assertEquals(11, node(graph, "provision Redis cluster").getProvenance().getLineNumber());
        assertEquals(10, graph.getStates().get(0).getProvenance().getLineNumber());
        assertEquals("decision.fs", graph.getStates().get(0).getProvenance().getSourceFile());
        assertEquals(NOW, graph.getStates().get(0).getProvenance().getTimestamp());
    }

    @Test
    void testMetadata() {
        FlowGraph graph = parser.parse("a -> b", "notes.fs");

        assertEquals(FlowGraph.CURRENT_VERSION, graph.getVersion());
        assertEquals(List.of("notes.fs"), graph.getMetadata().getSourceFiles());
        assertEquals(NOW, graph.getMetadata().getParsedAt());
        assertEquals("flowscript-java 1.0.0", graph.getMetadata().getProducer());
        assertNull(graph.getNodes().get(0).getProvenance().getAuthor());
    }

    @Test
    void testStandaloneStateAttachesToNextNode() {
        String source = """
            [blocked(reason: "api key pending", since: "2025-10-01")]
            deploy staging
            """;

        FlowGraph graph = parser.parse(source, "a.fs");

        assertEquals(1, graph.getStates().size());
        assertEquals(node(graph, "deploy staging").getId(), graph.getStates().get(0).getNodeId());
    }

    @Test
    void testDanglingStateIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("a\n[exploring]", "a.fs"));

        assertEquals(2, e.getLine());
        assertTrue(e.getDetail().contains("is not followed by a node"));
    }

    @Test
    void testRepeatedContentIsOneNode() {
        FlowGraph graph = parser.parse("! cache miss -> slow page\n* cache miss -> high load", "a.fs");

        assertEquals(3, graph.getNodes().size());
        Node cacheMiss = node(graph, "cache miss");
        assertEquals(Set.of(Modifier.URGENT, Modifier.HIGH_CONFIDENCE), cacheMiss.getModifiers());
        // first occurrence wins
        assertEquals(1, cacheMiss.getProvenance().getLineNumber());
    }

    @Test
    void testIdsAreDeterministic() {
        FlowScriptParser later = new FlowScriptParser(new ParserProperties(),
            Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));

        FlowGraph first = parser.parse("a  ->   b\nb ><[cost vs speed] c", "one.fs");
        FlowGraph second = later.parse("a -> b\nb ><[cost vs speed] c", "two.fs");

        assertEquals(ids(first), ids(second));
        assertEquals(
            first.getRelationships().stream().map(Relationship::getId).collect(Collectors.toList()),
            second.getRelationships().stream().map(Relationship::getId).collect(Collectors.toList()));
    }

    private static List<String> ids(FlowGraph graph) {
        return graph.getNodes().stream().map(Node::getId).collect(Collectors.toList());
    }

    @Test
    void testBareTensionIsAllowedByDefault() {
        FlowGraph graph = parser.parse("speed >< quality", "a.fs");

        assertNull(graph.getRelationships().get(0).getAxisLabel());
        assertFalse(graph.getInvariants().isTensionAxesLabeled());
    }

    @Test
    void testBareTensionFailsInStrictMode() {
        ParserProperties properties = new ParserProperties();
        properties.setRequireTensionAxis(true);
        FlowScriptParser strict = new FlowScriptParser(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        ParseException e = assertThrows(ParseException.class, () -> strict.parse("a\nspeed >< quality", "a.fs"));

        assertEquals(2, e.getLine());
        assertEquals("Tension operator '><' requires an axis label: ><[dimension of tradeoff]", e.getDetail());
    }

    @Test
    void testAuthorFromProperties() {
        ParserProperties properties = new ParserProperties();
        properties.getAuthor().setAgent("reviewer");
        FlowScriptParser withAuthor = new FlowScriptParser(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        FlowGraph graph = withAuthor.parse("a -> b", "a.fs");

        assertEquals("reviewer", graph.getNodes().get(0).getProvenance().getAuthor().getAgent());
    }

    @Test
    void testSyntaxErrors() {
        Map<String, String> cases = Map.of(
            "a ->", "Relation '->' is missing its target",
            "}", "Unexpected '}' without a matching '{'",
            "{a", "Unterminated group: missing '}'",
            "!", "Modifier ! must be followed by a node",
            "?", "Marker '?' must be followed by content",
            "-> b", "Relation '->' has no source node");

        cases.forEach((source, detail) -> {
            ParseException e = assertThrows(ParseException.class, () -> parser.parse(source, "bad.fs"), source);
            assertEquals(detail, e.getDetail(), source);
            assertEquals("bad.fs", e.getSourceFile());
        });
    }

    @Test
    void testErrorLineIsOriginalLine() {
        ParseException e = assertThrows(ParseException.class,
            () -> parser.parse("root\n  child\n\nother ->", "bad.fs"));

        assertEquals(4, e.getLine());
    }
}
