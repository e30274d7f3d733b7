package com.dcruver.flowscript.ir;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    @Test
    void testNodeIdIsSha256OfCanonicalJson() {
        // sha256 of {"content":"slow queries","type":"statement"}
        assertEquals("ccefc6ee1d73883a882b84fab53b07773e5ed1cd549d939b6881ee2bfd6c5264",
            ContentHasher.nodeId(NodeType.STATEMENT, "slow queries"));
    }

    @Test
    void testRelationshipIdIncludesNullAxis() {
        // sha256 of {"axis_label":null,"source":"a","target":"b","type":"causes"}
        assertEquals("cb0b96e388ed442edd91d170827b4f276d2662d4b37179b547e6650756bee596",
            ContentHasher.relationshipId(RelationType.CAUSES, "a", "b", null));
    }

    @Test
    void testNormalizationCollapsesWhitespace() {
        assertEquals("slow queries", ContentHasher.normalize("  slow \t\n queries "));
        assertEquals(ContentHasher.nodeId(NodeType.STATEMENT, "slow queries"),
            ContentHasher.nodeId(NodeType.STATEMENT, " slow   queries"));
    }

    @Test
    void testNormalizationPreservesCase() {
        assertNotEquals(ContentHasher.nodeId(NodeType.STATEMENT, "Redis"),
            ContentHasher.nodeId(NodeType.STATEMENT, "redis"));
    }

    @Test
    void testNormalizationComposesUnicode() {
        String decomposed = "cafe\u0301";
        assertEquals("caf\u00e9", ContentHasher.normalize(decomposed));
        assertEquals(ContentHasher.nodeId(NodeType.THOUGHT, "caf\u00e9"),
            ContentHasher.nodeId(NodeType.THOUGHT, decomposed));
    }

    @Test
    void testTypeIsPartOfIdentity() {
        assertNotEquals(ContentHasher.nodeId(NodeType.STATEMENT, "postgres"),
            ContentHasher.nodeId(NodeType.ALTERNATIVE, "postgres"));
    }

    @Test
    void testAxisLabelIsPartOfIdentity() {
        assertNotEquals(ContentHasher.relationshipId(RelationType.TENSION, "a", "b", "cost"),
            ContentHasher.relationshipId(RelationType.TENSION, "a", "b", "speed"));
    }

    @Test
    void testStateIdIgnoresFieldOrder() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("rationale", "fast");
        first.put("on", "2025-10-15");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("on", "2025-10-15");
        second.put("rationale", "fast");

        assertEquals(ContentHasher.stateId(StateType.DECIDED, "n1", first),
            ContentHasher.stateId(StateType.DECIDED, "n1", second));
        assertEquals(64, ContentHasher.stateId(StateType.DECIDED, "n1", first).length());
    }

    @Test
    void testNullContentNormalizesToEmpty() {
        assertEquals("", ContentHasher.normalize(null));
    }
}
