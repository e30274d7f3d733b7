package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of content. The id is the content hash of (type, content),
 * so identical content of the same type is always the same node.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Node {
    String id;
    NodeType type;
    String content;

    /** Immediate structural children, in source order */
    @Singular
    List<String> children;

    @Singular
    Set<Modifier> modifiers;

    Provenance provenance;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Singular("extension")
    Map<String, NodeExtension> ext;

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean is(NodeType nodeType) {
        return type == nodeType;
    }
}
