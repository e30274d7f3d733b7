package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A directed semantic edge between two nodes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Relationship {
    String id;
    RelationType type;
    String source;
    String target;

    /** Tension edges only */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String axisLabel;

    /** Intentional loop; exempt from cycle detection */
    boolean feedback;

    Provenance provenance;

    public boolean is(RelationType relationType) {
        return type == relationType;
    }

    public boolean touches(String nodeId) {
        return nodeId.equals(source) || nodeId.equals(target);
    }

    /** Endpoint on the other side of {@code nodeId} */
    public String opposite(String nodeId) {
        return nodeId.equals(source) ? target : source;
    }

    public boolean hasAxisLabel() {
        return axisLabel != null && !axisLabel.isBlank();
    }
}
