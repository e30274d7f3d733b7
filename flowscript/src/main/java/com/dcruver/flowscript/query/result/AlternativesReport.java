package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.query.AlternativesOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of an alternatives query. Fields populated depend on the format.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlternativesReport {
    AlternativesOptions.Format format;
    NodeRef question;

    // comparison
    List<AlternativeOption> alternatives;
    DecisionSummary decisionSummary;

    // simple
    List<String> optionsConsidered;
    String chosen;
    String reason;

    // tree
    List<AlternativeTree> tree;
}
