package com.dcruver.flowscript.lint;

import com.dcruver.flowscript.ir.FlowGraph;

import java.util.List;

/**
 * A single semantic check over a compiled graph.
 * Rules must not depend on each other or on execution order.
 */
public interface LintRule {
    /** Stable code, e.g. E005 */
    String getCode();

    /** Kebab-case rule name, e.g. causal-cycle */
    String getName();

    String getDescription();

    Severity getSeverity();

    List<Finding> evaluate(FlowGraph graph);
}
