package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of node types. A node's type comes from its marker, never from its content.
 */
public enum NodeType {
    /**
     * Plain text with no marker
     */
    STATEMENT,

    /**
     * {@code ?} marker
     */
    QUESTION,

    /**
     * {@code thought:} marker
     */
    THOUGHT,

    DECISION,

    BLOCKER,

    /**
     * {@code action:} marker; exempt from orphan detection
     */
    ACTION,

    /**
     * {@code ✓} marker; exempt from orphan detection
     */
    COMPLETION,

    /**
     * {@code ||} marker, linked to the nearest question
     */
    ALTERNATIVE,

    EXPLORING,

    PARKING,

    /**
     * Anonymous brace group
     */
    BLOCK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Task-like nodes may legitimately stand alone */
    public boolean isStandaloneTask() {
        return this == ACTION || this == COMPLETION;
    }
}
