package com.dcruver.flowscript.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lifecycle annotation attached to exactly one node.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class State {
    String id;
    StateType type;
    String nodeId;

    /** Named string values in source order */
    @Singular
    Map<String, String> fields;

    Provenance provenance;

    public String field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        String value = fields.get(name);
        return value != null && !value.isBlank();
    }

    public List<String> missingFields(List<String> names) {
        return names.stream()
            .filter(name -> !hasField(name))
            .collect(Collectors.toList());
    }
}
