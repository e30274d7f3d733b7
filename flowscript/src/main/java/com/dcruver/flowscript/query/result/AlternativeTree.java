package com.dcruver.flowscript.query.result;

import lombok.Value;

import java.util.List;

/**
 * Consequence tree under one alternative. A node already on the current path
 * appears once more as a leaf with {@code cycle} set.
 */
@Value
public class AlternativeTree {
    NodeRef node;
    boolean chosen;
    boolean cycle;
    List<AlternativeTree> children;
}
