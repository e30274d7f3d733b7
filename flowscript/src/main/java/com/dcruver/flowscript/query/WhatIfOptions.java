package com.dcruver.flowscript.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WhatIfOptions {
    /** Null means unbounded */
    Integer maxDepth;

    @Builder.Default
    Format format = Format.TREE;

    /** Follow {@code =>} edges as well as causal ones */
    @Builder.Default
    boolean includeTemporal = true;

    public static WhatIfOptions defaults() {
        return WhatIfOptions.builder().build();
    }

    public enum Format {
        TREE,
        LIST,
        SUMMARY
    }
}
