package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.query.TensionOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TensionReport {
    TensionOptions.GroupBy groupBy;

    Map<String, List<TensionDetail>> tensionsByAxis;

    /** Keyed by source node content */
    Map<String, List<TensionDetail>> tensionsByNode;

    List<TensionDetail> tensions;

    int totalTensions;
    List<String> uniqueAxes;
    String mostCommonAxis;
}
