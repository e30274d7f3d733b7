package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Prefix modifiers. They attach to the node that follows them.
 */
public enum Modifier {
    /** {@code !} */
    URGENT,
    /** {@code ++} */
    STRONG_POSITIVE,
    /** {@code *} */
    HIGH_CONFIDENCE,
    /** {@code ~} */
    LOW_CONFIDENCE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
