package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.query.WhyOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a why query. Which of chain, paths or ancestorIds is set depends on the format.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CausalAncestry {
    WhyOptions.Format format;
    NodeRef target;

    List<ChainLink> chain;

    /** Each path runs from the target back to a root cause or the depth limit */
    List<List<NodeRef>> paths;

    List<String> ancestorIds;

    List<NodeRef> rootCauses;

    List<String> rootCauseIds;

    int totalAncestors;
    int maxDepthReached;
    boolean hasMultiplePaths;
}
