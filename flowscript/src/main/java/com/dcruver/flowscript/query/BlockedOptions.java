package com.dcruver.flowscript.query;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BlockedOptions {
    /** Keep blockers whose own since date is on or after this date */
    LocalDate since;

    @Builder.Default
    Format format = Format.DETAILED;

    public static BlockedOptions defaults() {
        return BlockedOptions.builder().build();
    }

    public enum Format {
        DETAILED,
        SUMMARY,
        LIST
    }
}
