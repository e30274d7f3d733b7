package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.ir.Author;
import com.dcruver.flowscript.ir.ContentHasher;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.GraphMetadata;
import com.dcruver.flowscript.ir.Modifier;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.Provenance;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.ir.StateType;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects the entities of one parse, deduplicating by content-hash id.
 * The first occurrence of a node keeps its provenance; later ones merge modifiers and children.
 */
class GraphAssembler {

    private final ScanResult scan;
    private final String sourceFile;
    private final Instant timestamp;
    private final Author author;
    private final String producer;

    private final Map<String, NodeDraft> nodes = new LinkedHashMap<>();
    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private final Map<String, State> states = new LinkedHashMap<>();

    GraphAssembler(ScanResult scan, String sourceFile, Instant timestamp, Author author, String producer) {
        this.scan = scan;
        this.sourceFile = sourceFile;
        this.timestamp = timestamp;
        this.author = author;
        this.producer = producer;
    }

    String addNode(NodeType type, String content, Set<Modifier> modifiers, int line) {
        String normalized = ContentHasher.normalize(content);
        String id = ContentHasher.nodeId(type, normalized);
        NodeDraft draft = nodes.computeIfAbsent(id, k -> new NodeDraft(id, type, normalized, provenance(line)));
        draft.modifiers.addAll(modifiers);
        return id;
    }

    void addChildren(String parentId, Collection<String> childIds) {
        NodeDraft parent = nodes.get(parentId);
        for (String childId : childIds) {
            if (!childId.equals(parentId)) {
                parent.children.add(childId);
            }
        }
    }

    void addRelationship(RelationType type, String source, String target, String axisLabel,
                         boolean feedback, int line) {
        String id = ContentHasher.relationshipId(type, source, target, axisLabel);
        relationships.putIfAbsent(id, Relationship.builder()
            .id(id)
            .type(type)
            .source(source)
            .target(target)
            .axisLabel(axisLabel)
            .feedback(feedback)
            .provenance(provenance(line))
            .build());
    }

    void addState(StateType type, String nodeId, Map<String, String> fields, int line) {
        String id = ContentHasher.stateId(type, nodeId, fields);
        states.putIfAbsent(id, State.builder()
            .id(id)
            .type(type)
            .nodeId(nodeId)
            .fields(fields)
            .provenance(provenance(line))
            .build());
    }

    NodeType typeOf(String nodeId) {
        return nodes.get(nodeId).type;
    }

    String contentOf(String nodeId) {
        return nodes.get(nodeId).content;
    }

    FlowGraph build() {
        return FlowGraph.builder()
            .version(FlowGraph.CURRENT_VERSION)
            .nodes(nodes.values().stream().map(NodeDraft::toNode).collect(Collectors.toList()))
            .relationships(relationships.values())
            .states(states.values())
            .metadata(GraphMetadata.builder()
                .sourceFile(sourceFile)
                .parsedAt(timestamp)
                .producer(producer)
                .build())
            .build();
    }

    private Provenance provenance(int transformedLine) {
        return Provenance.builder()
            .sourceFile(sourceFile)
            .lineNumber(scan.originalLine(transformedLine))
            .timestamp(timestamp)
            .author(author)
            .producer(producer)
            .build();
    }

    private static final class NodeDraft {
        private final String id;
        private final NodeType type;
        private final String content;
        private final Provenance provenance;
        private final Set<String> children = new LinkedHashSet<>();
        private final Set<Modifier> modifiers = new LinkedHashSet<>();

        private NodeDraft(String id, NodeType type, String content, Provenance provenance) {
            this.id = id;
            this.type = type;
            this.content = content;
            this.provenance = provenance;
        }

        private Node toNode() {
            return Node.builder()
                .id(id)
                .type(type)
                .content(content)
                .children(children)
                .modifiers(modifiers)
                .provenance(provenance)
                .build();
        }
    }
}
