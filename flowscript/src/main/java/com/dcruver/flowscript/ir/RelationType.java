package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic edge types. Causal edges always point from cause to effect.
 */
public enum RelationType {
    /** {@code A -> B} */
    CAUSES,
    /** {@code A => B} */
    TEMPORAL,
    /** {@code A <- B}, stored as B to A */
    DERIVES_FROM,
    /** {@code A <-> B}, always flagged as feedback */
    BIDIRECTIONAL,
    /** {@code A ><[axis] B} */
    TENSION,
    /** {@code A = B} */
    EQUIVALENT,
    /** {@code A != B} */
    DIFFERENT,
    /** question to one of its alternatives */
    ALTERNATIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCausal() {
        return this == CAUSES || this == DERIVES_FROM;
    }
}
