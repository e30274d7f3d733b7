package com.dcruver.flowscript.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class GraphMetadata {
    @Singular
    List<String> sourceFiles;

    Instant parsedAt;

    String producer;
}
