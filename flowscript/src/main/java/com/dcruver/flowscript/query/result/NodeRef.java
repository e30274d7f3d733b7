package com.dcruver.flowscript.query.result;

import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.NodeType;
import lombok.Value;

/**
 * Lightweight reference to a node in query results.
 */
@Value
public class NodeRef {
    String id;
    NodeType type;
    String content;

    public static NodeRef of(Node node) {
        return new NodeRef(node.getId(), node.getType(), node.getContent());
    }
}
