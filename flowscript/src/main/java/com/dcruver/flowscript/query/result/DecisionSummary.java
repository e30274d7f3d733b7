package com.dcruver.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionSummary {
    String chosen;
    String rationale;
    List<String> rejected;

    /** Tension axes that bear on the outcome */
    List<String> keyFactors;
}
