package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.ir.RelationType;
import lombok.Value;

/**
 * An ancestor at its minimal distance from the queried node.
 */
@Value
public class ChainLink {
    int depth;
    NodeRef node;

    /** Edge type that first reached this ancestor */
    RelationType relationshipType;
}
