package com.dcruver.flowscript.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The compiled document: flat, id-keyed collections of nodes, relationships and states.
 * Hierarchy lives in {@link Node#getChildren()} id lists, never in object references.
 * Immutable once built.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class FlowGraph {
    public static final String CURRENT_VERSION = "1.0.0";

    String version;

    @Singular
    List<Node> nodes;

    @Singular
    List<Relationship> relationships;

    @Singular
    List<State> states;

    GraphMetadata metadata;

    GraphInvariants invariants;

    public Optional<Node> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    /** Fresh id to node index, in document order */
    public Map<String, Node> nodeIndex() {
        Map<String, Node> index = new LinkedHashMap<>();
        for (Node node : nodes) {
            index.put(node.getId(), node);
        }
        return index;
    }

    /**
     * Nodes that are not an edge endpoint, not anybody's child and have no children.
     * Actions and completions are never orphans.
     */
    public List<Node> orphanedNodes() {
        Set<String> connected = new HashSet<>();
        for (Relationship rel : relationships) {
            connected.add(rel.getSource());
            connected.add(rel.getTarget());
        }
        for (Node node : nodes) {
            if (node.hasChildren()) {
                connected.add(node.getId());
                connected.addAll(node.getChildren());
            }
        }
        return nodes.stream()
            .filter(n -> !n.getType().isStandaloneTask())
            .filter(n -> !connected.contains(n.getId()))
            .collect(Collectors.toList());
    }
}
