package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

/**
 * Who wrote the source: a named agent acting as a human or an AI.
 */
@Value
@Builder
@Jacksonized
public class Author {
    String agent;
    Role role;

    public enum Role {
        HUMAN,
        AI;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
