package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Lifecycle states, with the fields each one must or should carry.
 */
public enum StateType {
    DECIDED(List.of("rationale", "on"), List.of()),
    EXPLORING(List.of(), List.of()),
    BLOCKED(List.of("reason", "since"), List.of()),
    PARKING(List.of(), List.of("why", "until"));

    private final List<String> requiredFields;
    private final List<String> recommendedFields;

    StateType(List<String> requiredFields, List<String> recommendedFields) {
        this.requiredFields = requiredFields;
        this.recommendedFields = recommendedFields;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public List<String> recommendedFields() {
        return recommendedFields;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Look up a state by its marker keyword, e.g. {@code decided}
     */
    public static StateType fromKeyword(String keyword) {
        for (StateType type : values()) {
            if (type.wireName().equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
