package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.LinterProperties;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural nesting (children lists) deeper than the configured limit.
 * Reported once per subtree, at the first node past the limit.
 */
@Component
public class DeepNestingRule extends AbstractLintRule {

    private final LinterProperties properties;

    public DeepNestingRule(LinterProperties properties) {
        super("W002", "deep-nesting", "Structural nesting should stay shallow", Severity.WARNING);
        this.properties = properties;
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        Map<String, Node> nodes = graph.nodeIndex();
        Set<String> nested = new HashSet<>();
        for (Node node : graph.getNodes()) {
            nested.addAll(node.getChildren());
        }

        List<Finding> findings = new ArrayList<>();
        Set<String> reached = new HashSet<>();
        for (Node node : graph.getNodes()) {
            if (!nested.contains(node.getId())) {
                markReachable(node.getId(), nodes, reached);
                walk(node, 0, nodes, new HashSet<>(), findings);
            }
        }
        // children cycles have no root; start from the first node of each
        for (Node node : graph.getNodes()) {
            if (!reached.contains(node.getId())) {
                markReachable(node.getId(), nodes, reached);
                walk(node, 0, nodes, new HashSet<>(), findings);
            }
        }
        return findings;
    }

    private static void markReachable(String id, Map<String, Node> nodes, Set<String> reached) {
        Deque<String> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            String next = queue.poll();
            Node node = nodes.get(next);
            if (node != null && reached.add(next)) {
                queue.addAll(node.getChildren());
            }
        }
    }

    private void walk(Node node, int depth, Map<String, Node> nodes, Set<String> path, List<Finding> findings) {
        int max = properties.getMaxNestingDepth();
        if (depth > max) {
            findings.add(finding(
                String.format("Node %s is nested %d levels deep (max %d)", quote(node.getContent()), depth, max),
                node.getProvenance(),
                "Extract the nested content into its own top-level thought and link to it"));
            return;
        }
        if (!path.add(node.getId())) {
            return;
        }
        for (String childId : node.getChildren()) {
            Node child = nodes.get(childId);
            if (child != null) {
                walk(child, depth + 1, nodes, path, findings);
            }
        }
        path.remove(node.getId());
    }
}
