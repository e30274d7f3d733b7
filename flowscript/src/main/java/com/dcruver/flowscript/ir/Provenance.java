package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Where an IR entity came from. Line numbers are always original source lines.
 */
@Value
@Builder
@With
@Jacksonized
public class Provenance {
    String sourceFile;
    int lineNumber;
    Instant timestamp;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Author author;

    String producer;
}
