package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.LinterProperties;
import com.dcruver.flowscript.lint.Severity;
import com.dcruver.flowscript.parse.FlowScriptParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LongCausalChainRuleTest {

    private final FlowScriptParser parser = new FlowScriptParser();

    private List<Finding> evaluate(String source, int maxLength) {
        LinterProperties properties = new LinterProperties();
        properties.setMaxCausalChainLength(maxLength);
        return new LongCausalChainRule(properties).evaluate(parser.parse(source, "chain.fs"));
    }

    @Test
    void testChainAtLimitIsAccepted() {
        assertTrue(evaluate("a -> b -> c", 3).isEmpty());
    }

    @Test
    void testChainPastLimitWarns() {
        List<Finding> findings = evaluate("a -> b -> c -> d", 3);

        assertEquals(1, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).getSeverity());
        assertEquals("Causal chain of 4 nodes starting at \"a\" exceeds 3", findings.get(0).getMessage());
    }

    @Test
    void testDerivesFromCountsTowardChain() {
        // d <- c reads as c causes d
        List<Finding> findings = evaluate("a -> b -> c\nd <- c", 3);

        assertEquals(1, findings.size());
    }

    @Test
    void testChainLeavingACycleWarns() {
        List<Finding> findings = evaluate("a -> b -> a\nb -> c -> d -> e -> f", 3);

        assertEquals(1, findings.size());
        assertEquals("Causal chain of 6 nodes starting at \"a\" exceeds 3", findings.get(0).getMessage());
    }

    @Test
    void testShortCycleAloneIsAccepted() {
        assertTrue(evaluate("a -> b -> a", 3).isEmpty());
    }

    @Test
    void testTemporalEdgesDoNotCount() {
        assertTrue(evaluate("a -> b => c => d", 3).isEmpty());
    }
}
