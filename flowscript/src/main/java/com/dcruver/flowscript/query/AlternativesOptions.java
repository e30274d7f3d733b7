package com.dcruver.flowscript.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlternativesOptions {
    @Builder.Default
    Format format = Format.COMPARISON;

    @Builder.Default
    boolean showRejectedReasons = true;

    /** Depth bound for the consequence tree */
    @Builder.Default
    int maxDepth = 10;

    public static AlternativesOptions defaults() {
        return AlternativesOptions.builder().build();
    }

    public enum Format {
        COMPARISON,
        SIMPLE,
        TREE
    }
}
