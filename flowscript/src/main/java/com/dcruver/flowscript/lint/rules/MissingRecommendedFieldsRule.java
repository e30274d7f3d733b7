package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MissingRecommendedFieldsRule extends AbstractLintRule {

    public MissingRecommendedFieldsRule() {
        super("W001", "missing-recommended-fields", "Parked items should say why and until when", Severity.WARNING);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (State state : graph.getStates()) {
            List<String> missing = state.missingFields(state.getType().recommendedFields());
            if (!missing.isEmpty()) {
                findings.add(finding(
                    String.format("[%s] state is missing recommended fields: %s",
                        state.getType().wireName(), String.join(", ", missing)),
                    state.getProvenance(),
                    "Add context: [parking(why: \"...\", until: \"...\")]"));
            }
        }
        return findings;
    }
}
