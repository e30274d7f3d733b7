package com.dcruver.flowscript.lint;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.lint.rules.CausalCycleRule;
import com.dcruver.flowscript.lint.rules.DeepNestingRule;
import com.dcruver.flowscript.lint.rules.LongCausalChainRule;
import com.dcruver.flowscript.lint.rules.MissingRecommendedFieldsRule;
import com.dcruver.flowscript.lint.rules.MissingRequiredFieldsRule;
import com.dcruver.flowscript.lint.rules.MultipleStatesRule;
import com.dcruver.flowscript.lint.rules.OrphanedNodeRule;
import com.dcruver.flowscript.lint.rules.UnlabeledTensionRule;
import com.dcruver.flowscript.lint.rules.UnresolvedAlternativesRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered {@link LintRule} over a graph and collects the findings.
 * A rule that throws is reported as an ERROR finding under its own code; the others still run.
 */
@Component
@Slf4j
public class SemanticLinter {

    private static final Comparator<Finding> REPORT_ORDER = Comparator
        .comparing((Finding f) -> f.isError() ? 0 : 1)
        .thenComparingInt(f -> f.getLocation().getLine());

    private final List<LintRule> rules;

    public SemanticLinter(List<LintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Linter with the full standard rule set
     */
    public static SemanticLinter withDefaultRules(LinterProperties properties) {
        return new SemanticLinter(List.of(
            new UnlabeledTensionRule(),
            new MissingRequiredFieldsRule(),
            new MultipleStatesRule(),
            new OrphanedNodeRule(),
            new CausalCycleRule(),
            new UnresolvedAlternativesRule(),
            new MissingRecommendedFieldsRule(),
            new DeepNestingRule(properties),
            new LongCausalChainRule(properties)));
    }

    public List<LintRule> getRules() {
        return rules;
    }

    public LintReport lint(FlowGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (LintRule rule : rules) {
            try {
                List<Finding> ruleFindings = rule.evaluate(graph);
                log.debug("Rule {} ({}) produced {} findings", rule.getCode(), rule.getName(), ruleFindings.size());
                findings.addAll(ruleFindings);
            } catch (RuntimeException e) {
                log.error("Lint rule {} ({}) failed", rule.getCode(), rule.getName(), e);
                findings.add(Finding.builder()
                    .severity(Severity.ERROR)
                    .code(rule.getCode())
                    .rule(rule.getName())
                    .message("Rule failed to run: " + e.getMessage())
                    .location(new SourceLocation(firstSourceFile(graph), 0))
                    .build());
            }
        }

        findings.sort(REPORT_ORDER);
        LintReport report = new LintReport(findings);
        log.info("Lint finished: {} error(s), {} warning(s)", report.getErrorCount(), report.getWarningCount());
        return report;
    }

    private static String firstSourceFile(FlowGraph graph) {
        if (graph.getMetadata() == null || graph.getMetadata().getSourceFiles().isEmpty()) {
            return null;
        }
        return graph.getMetadata().getSourceFiles().get(0);
    }
}
