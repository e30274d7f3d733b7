package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.ir.RelationType;
import lombok.Value;

@Value
public class Consequence {
    int depth;
    NodeRef node;
    RelationType relationshipType;

    /** The consequence is an endpoint of some tension */
    boolean inTension;
}
