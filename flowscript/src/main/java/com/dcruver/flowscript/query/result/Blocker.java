package com.dcruver.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Blocker {
    NodeRef node;
    String reason;
    String since;
    int daysBlocked;

    /** What blocks the blocker */
    List<NodeRef> transitiveCauses;

    /** What the blocker holds up */
    List<NodeRef> transitiveEffects;

    int causeCount;
    int effectCount;

    /** days + causes + 2 x effects */
    int impactScore;
    Priority priority;
}
