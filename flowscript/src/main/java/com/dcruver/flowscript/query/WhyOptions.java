package com.dcruver.flowscript.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WhyOptions {
    /** Null means unbounded */
    Integer maxDepth;

    @Builder.Default
    Format format = Format.CHAIN;

    public static WhyOptions defaults() {
        return WhyOptions.builder().build();
    }

    public enum Format {
        /** Every ancestor once, ordered by depth */
        CHAIN,
        /** Every ancestor path */
        TREE,
        /** Ids only */
        MINIMAL
    }
}
