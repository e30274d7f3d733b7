package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A node is in at most one lifecycle state.
 */
@Component
public class MultipleStatesRule extends AbstractLintRule {

    public MultipleStatesRule() {
        super("E003", "multiple-states", "A node may carry at most one state", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        Map<String, List<State>> byNode = new LinkedHashMap<>();
        for (State state : graph.getStates()) {
            byNode.computeIfAbsent(state.getNodeId(), k -> new ArrayList<>()).add(state);
        }

        Map<String, Node> nodes = graph.nodeIndex();
        List<Finding> findings = new ArrayList<>();
        byNode.forEach((nodeId, states) -> {
            if (states.size() < 2) {
                return;
            }
            Node node = nodes.get(nodeId);
            String types = states.stream()
                .map(s -> s.getType().wireName())
                .collect(Collectors.joining(", "));
            findings.add(finding(
                String.format("Node %s has %d states (%s); only one is allowed",
                    quote(node == null ? nodeId : node.getContent()), states.size(), types),
                states.get(1).getProvenance(),
                "Keep a single state marker and move history into a thought"));
        });
        return findings;
    }
}
