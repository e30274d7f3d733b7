package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.CausalGraph;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Causation must not loop back on itself unless the loop is marked as feedback.
 */
@Component
public class CausalCycleRule extends AbstractLintRule {

    public CausalCycleRule() {
        super("E005", "causal-cycle", "Causal relationships must not form cycles", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        Map<String, Node> nodes = graph.nodeIndex();
        List<Finding> findings = new ArrayList<>();

        for (List<String> cycle : CausalGraph.of(graph).findCycles()) {
            String path = cycle.stream()
                .map(id -> nodes.containsKey(id) ? quote(nodes.get(id).getContent()) : id)
                .collect(Collectors.joining(" -> "));
            Node first = nodes.get(cycle.get(0));
            findings.add(finding(
                "Causal cycle detected: " + path,
                first == null ? null : first.getProvenance(),
                "Fix: Use <-> for feedback loops, or use => for temporal sequence, or break the cycle"));
        }
        return findings;
    }
}
