package com.dcruver.flowscript.io;

import com.dcruver.flowscript.exception.SchemaException;
import com.dcruver.flowscript.ir.ContentHasher;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.Provenance;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.ir.State;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for a graph read from outside the parser.
 *
 * <p>Covers the shape of the document, not its semantics: ids are present, unique and equal
 * to their recomputed content hash; every reference resolves; provenance is complete;
 * axis labels appear only on tensions. Semantic problems are the linter's concern.
 */
@Component
@Slf4j
public class IrSchemaValidator {

    public ValidationResult validate(FlowGraph graph) {
        List<String> violations = new ArrayList<>();

        if (graph.getVersion() == null || !graph.getVersion().startsWith("1.")) {
            violations.add("Unsupported IR version: " + graph.getVersion());
        }
        if (graph.getMetadata() == null) {
            violations.add("Missing metadata block");
        } else if (graph.getMetadata().getParsedAt() == null) {
            violations.add("Metadata is missing parsed_at");
        }
        if (graph.getInvariants() == null) {
            violations.add("Missing invariants block");
        }

        Set<String> nodeIds = new HashSet<>();
        for (Node node : graph.getNodes()) {
            checkNode(node, nodeIds, violations);
        }
        for (Node node : graph.getNodes()) {
            for (String childId : node.getChildren()) {
                if (!nodeIds.contains(childId)) {
                    violations.add("Node " + node.getId() + " lists unknown child " + childId);
                } else if (childId.equals(node.getId())) {
                    violations.add("Node " + node.getId() + " lists itself as a child");
                }
            }
        }

        Set<String> relationshipIds = new HashSet<>();
        for (Relationship rel : graph.getRelationships()) {
            checkRelationship(rel, nodeIds, relationshipIds, violations);
        }

        Set<String> stateIds = new HashSet<>();
        for (State state : graph.getStates()) {
            checkState(state, nodeIds, stateIds, violations);
        }

        if (!violations.isEmpty()) {
            log.warn("IR failed validation with {} violation(s)", violations.size());
        }
        return new ValidationResult(violations);
    }

    /**
     * Validate and throw {@link SchemaException} listing every violation
     */
    public FlowGraph requireValid(FlowGraph graph) {
        ValidationResult result = validate(graph);
        if (!result.isValid()) {
            throw new SchemaException(result.getViolations());
        }
        return graph;
    }

    private void checkNode(Node node, Set<String> nodeIds, List<String> violations) {
        String label = "Node " + node.getId();
        if (isBlank(node.getId())) {
            violations.add("Node with blank id");
            return;
        }
        if (!nodeIds.add(node.getId())) {
            violations.add("Duplicate node id " + node.getId());
        }
        if (node.getType() == null) {
            violations.add(label + " has no type");
        } else if (node.getContent() == null) {
            violations.add(label + " has no content");
        } else if (!node.getId().equals(ContentHasher.nodeId(node.getType(), node.getContent()))) {
            violations.add(label + " does not match the hash of its type and content");
        }
        checkProvenance(label, node.getProvenance(), violations);
    }

    private void checkRelationship(Relationship rel, Set<String> nodeIds, Set<String> seen, List<String> violations) {
        String label = "Relationship " + rel.getId();
        if (isBlank(rel.getId())) {
            violations.add("Relationship with blank id");
            return;
        }
        if (!seen.add(rel.getId())) {
            violations.add("Duplicate relationship id " + rel.getId());
        }
        if (rel.getType() == null) {
            violations.add(label + " has no type");
        } else {
            if (rel.getAxisLabel() != null && rel.getType() != RelationType.TENSION) {
                violations.add(label + " carries an axis label but is of type " + rel.getType().wireName());
            }
            String expected = ContentHasher.relationshipId(rel.getType(), rel.getSource(), rel.getTarget(), rel.getAxisLabel());
            if (!rel.getId().equals(expected)) {
                violations.add(label + " does not match the hash of its type, endpoints and axis");
            }
        }
        if (!nodeIds.contains(rel.getSource())) {
            violations.add(label + " references unknown source " + rel.getSource());
        }
        if (!nodeIds.contains(rel.getTarget())) {
            violations.add(label + " references unknown target " + rel.getTarget());
        }
        checkProvenance(label, rel.getProvenance(), violations);
    }

    private void checkState(State state, Set<String> nodeIds, Set<String> seen, List<String> violations) {
        String label = "State " + state.getId();
        if (isBlank(state.getId())) {
            violations.add("State with blank id");
            return;
        }
        if (!seen.add(state.getId())) {
            violations.add("Duplicate state id " + state.getId());
        }
        if (state.getType() == null) {
            violations.add(label + " has no type");
        } else if (!state.getId().equals(ContentHasher.stateId(state.getType(), state.getNodeId(), state.getFields()))) {
            violations.add(label + " does not match the hash of its type, node and fields");
        }
        if (!nodeIds.contains(state.getNodeId())) {
            violations.add(label + " references unknown node " + state.getNodeId());
        }
        checkProvenance(label, state.getProvenance(), violations);
    }

    private static void checkProvenance(String label, Provenance provenance, List<String> violations) {
        if (provenance == null) {
            violations.add(label + " has no provenance");
            return;
        }
        if (isBlank(provenance.getSourceFile())) {
            violations.add(label + " provenance has no source_file");
        }
        if (provenance.getLineNumber() < 1) {
            violations.add(label + " provenance line_number must be at least 1");
        }
        if (provenance.getTimestamp() == null) {
            violations.add(label + " provenance has no timestamp");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
