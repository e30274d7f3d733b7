package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Every tension must name the dimension being traded off.
 */
@Component
public class UnlabeledTensionRule extends AbstractLintRule {

    public UnlabeledTensionRule() {
        super("E001", "unlabeled-tension", "Tension relationships must carry an axis label", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        Map<String, Node> nodes = graph.nodeIndex();
        List<Finding> findings = new ArrayList<>();

        for (Relationship rel : graph.getRelationships()) {
            if (rel.is(RelationType.TENSION) && !rel.hasAxisLabel()) {
                findings.add(finding(
                    String.format("Tension between %s and %s is missing an axis label",
                        quote(contentOf(nodes, rel.getSource())), quote(contentOf(nodes, rel.getTarget()))),
                    rel.getProvenance(),
                    "Add axis label: ><[dimension of tradeoff]"));
            }
        }
        return findings;
    }

    private static String contentOf(Map<String, Node> nodes, String id) {
        Node node = nodes.get(id);
        return node == null ? id : node.getContent();
    }
}
