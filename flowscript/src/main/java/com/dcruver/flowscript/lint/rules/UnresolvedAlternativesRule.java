package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.ir.StateType;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A question that lists alternatives must be decided or explicitly parked.
 *
 * <p>Resolution is content based: the question is decided when any of its descendants
 * has the same content as a node carrying a {@code decided} state. A hybrid decision nested
 * under the question therefore counts even when it matches no single alternative.
 */
@Component
public class UnresolvedAlternativesRule extends AbstractLintRule {

    public UnresolvedAlternativesRule() {
        super("E006", "unresolved-alternatives", "Questions with alternatives need a decision or parking", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        Map<String, Node> nodes = graph.nodeIndex();

        Set<String> decidedContents = new HashSet<>();
        Set<String> parkedNodes = new HashSet<>();
        for (State state : graph.getStates()) {
            Node node = nodes.get(state.getNodeId());
            if (node == null) {
                continue;
            }
            if (state.getType() == StateType.DECIDED) {
                decidedContents.add(node.getContent());
            } else if (state.getType() == StateType.PARKING) {
                parkedNodes.add(node.getId());
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (Node question : graph.getNodes()) {
            if (!question.is(NodeType.QUESTION)) {
                continue;
            }
            Set<String> alternatives = alternativesOf(question, graph, nodes);
            if (alternatives.isEmpty()) {
                continue;
            }
            if (parkedNodes.contains(question.getId())) {
                continue;
            }
            if (hasDecidedDescendant(question, nodes, decidedContents)) {
                continue;
            }
            findings.add(finding(
                String.format("Question %s has %d alternative%s but no decision",
                    quote(question.getContent()), alternatives.size(), alternatives.size() == 1 ? "" : "s"),
                question.getProvenance(),
                "Either: (1) Mark chosen alternative with [decided(rationale: \"...\", on: \"...\")] "
                    + "OR (2) Park question with [parking(why: \"...\", until: \"...\")]"));
        }
        return findings;
    }

    private static Set<String> alternativesOf(Node question, FlowGraph graph, Map<String, Node> nodes) {
        Set<String> alternatives = new LinkedHashSet<>();
        for (String childId : question.getChildren()) {
            Node child = nodes.get(childId);
            if (child != null && child.is(NodeType.ALTERNATIVE)) {
                alternatives.add(childId);
            }
        }
        for (Relationship rel : graph.getRelationships()) {
            if (rel.is(RelationType.ALTERNATIVE) && rel.getSource().equals(question.getId())) {
                alternatives.add(rel.getTarget());
            }
        }
        return alternatives;
    }

    private static boolean hasDecidedDescendant(Node question, Map<String, Node> nodes, Set<String> decidedContents) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(question.getChildren());
        visited.add(question.getId());

        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            Node node = nodes.get(id);
            if (node == null) {
                continue;
            }
            if (decidedContents.contains(node.getContent())) {
                return true;
            }
            queue.addAll(node.getChildren());
        }
        return false;
    }
}
