package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.CausalGraph;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.LinterProperties;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class LongCausalChainRule extends AbstractLintRule {

    private final LinterProperties properties;

    public LongCausalChainRule(LinterProperties properties) {
        super("W003", "long-causal-chain", "Causal chains should stay short enough to follow", Severity.WARNING);
        this.properties = properties;
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        int max = properties.getMaxCausalChainLength();
        Map<String, Node> nodes = graph.nodeIndex();
        List<Finding> findings = new ArrayList<>();

        CausalGraph.of(graph).longestChainsFromRoots().forEach((rootId, chain) -> {
            if (chain.size() <= max) {
                return;
            }
            Node root = nodes.get(rootId);
            findings.add(finding(
                String.format("Causal chain of %d nodes starting at %s exceeds %d",
                    chain.size(), quote(root == null ? rootId : root.getContent()), max),
                root == null ? null : root.getProvenance(),
                "Summarize intermediate steps or split the chain into separate analyses"));
        });
        return findings;
    }
}
