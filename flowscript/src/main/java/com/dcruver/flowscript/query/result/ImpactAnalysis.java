package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.query.WhatIfOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a what-if query.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImpactAnalysis {
    WhatIfOptions.Format format;
    NodeRef source;

    // tree
    List<Consequence> directConsequences;
    List<Consequence> indirectConsequences;
    List<TensionRef> tensionsInImpactZone;

    // list
    List<Consequence> consequences;

    // summary
    String impactSummary;
    List<String> benefits;
    List<String> risks;
    String keyTradeoff;

    int totalDescendants;
    int maxDepthReached;
    boolean hasTemporalConsequences;
}
