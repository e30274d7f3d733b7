package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.query.BlockedOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlockerReport {
    BlockedOptions.Format format;

    /** Highest impact first */
    List<Blocker> blockers;

    int totalBlockers;
    int highPriorityCount;
    double averageDaysBlocked;
    NodeRef oldestBlocker;
    int oldestDaysBlocked;
}
