package com.dcruver.flowscript.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Summary of structural properties, computed from the graph when it is produced.
 */
@Value
@Builder
@Jacksonized
public class GraphInvariants {
    boolean causalAcyclic;
    boolean allNodesReachable;
    boolean tensionAxesLabeled;
    boolean stateFieldsPresent;

    public static GraphInvariants of(FlowGraph graph) {
        boolean acyclic = CausalGraph.of(graph).findCycles().isEmpty();
        boolean reachable = graph.orphanedNodes().isEmpty();
        boolean labeled = graph.getRelationships().stream()
            .filter(r -> r.is(RelationType.TENSION))
            .allMatch(Relationship::hasAxisLabel);
        boolean fieldsPresent = graph.getStates().stream()
            .allMatch(s -> s.missingFields(s.getType().requiredFields()).isEmpty());

        return GraphInvariants.builder()
            .causalAcyclic(acyclic)
            .allNodesReachable(reachable)
            .tensionAxesLabeled(labeled)
            .stateFieldsPresent(fieldsPresent)
            .build();
    }
}
