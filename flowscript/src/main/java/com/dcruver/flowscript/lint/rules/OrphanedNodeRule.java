package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Content must be connected: an edge endpoint, a child, or a parent.
 * Actions and completions may stand alone.
 */
@Component
public class OrphanedNodeRule extends AbstractLintRule {

    public OrphanedNodeRule() {
        super("E004", "orphaned-node", "Nodes must be connected to the graph", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        return graph.orphanedNodes().stream()
            .map(this::toFinding)
            .collect(Collectors.toList());
    }

    private Finding toFinding(Node node) {
        return finding(
            String.format("%s node %s is not connected to anything", node.getType().wireName(), quote(node.getContent())),
            node.getProvenance(),
            "Relate it to another node (->, <-, ><[axis]) or nest it under a parent");
    }
}
