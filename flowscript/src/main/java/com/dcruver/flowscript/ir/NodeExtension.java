package com.dcruver.flowscript.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Versioned, namespaced extension data attached to a node.
 * Unknown namespaces are carried through serialization untouched.
 */
@Value
@Builder
@Jacksonized
public class NodeExtension {
    int version;

    @Singular
    Map<String, String> values;
}
