package com.dcruver.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TensionDetail {
    String relationshipId;
    String axis;
    NodeRef source;
    NodeRef target;

    /** Nodes leading into the source; only when context was requested */
    List<NodeRef> context;
}
