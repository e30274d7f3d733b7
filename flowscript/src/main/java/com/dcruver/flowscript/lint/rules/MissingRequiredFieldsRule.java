package com.dcruver.flowscript.lint.rules;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.lint.AbstractLintRule;
import com.dcruver.flowscript.lint.Finding;
import com.dcruver.flowscript.lint.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decisions need a rationale and a date; blockers need a reason and a since date.
 */
@Component
public class MissingRequiredFieldsRule extends AbstractLintRule {

    public MissingRequiredFieldsRule() {
        super("E002", "missing-required-fields", "States must carry their required fields", Severity.ERROR);
    }

    @Override
    public List<Finding> evaluate(FlowGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (State state : graph.getStates()) {
            List<String> required = state.getType().requiredFields();
            List<String> missing = state.missingFields(required);
            if (missing.isEmpty()) {
                continue;
            }
            String keyword = state.getType().wireName();
            findings.add(finding(
                String.format("[%s] state is missing required field%s: %s",
                    keyword, missing.size() == 1 ? "" : "s", String.join(", ", missing)),
                state.getProvenance(),
                "Use " + template(keyword, required)));
        }
        return findings;
    }

    private static String template(String keyword, List<String> fields) {
        return fields.stream()
            .map(f -> f + ": \"...\"")
            .collect(Collectors.joining(", ", "[" + keyword + "(", ")]"));
    }
}
