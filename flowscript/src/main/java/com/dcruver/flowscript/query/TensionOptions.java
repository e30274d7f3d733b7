package com.dcruver.flowscript.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TensionOptions {
    @Builder.Default
    GroupBy groupBy = GroupBy.AXIS;

    /** Only tensions on this axis; case-insensitive */
    String filterByAxis;

    /** Attach the nodes that lead into each tension */
    boolean includeContext;

    /** Restrict to the subgraph reachable from this node id */
    String scope;

    public static TensionOptions defaults() {
        return TensionOptions.builder().build();
    }

    public enum GroupBy {
        AXIS,
        NODE,
        NONE
    }
}
