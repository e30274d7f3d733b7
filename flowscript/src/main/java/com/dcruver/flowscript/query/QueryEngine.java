package com.dcruver.flowscript.query;

import com.dcruver.flowscript.exception.InvalidIrException;
import com.dcruver.flowscript.exception.InvalidNodeTypeException;
import com.dcruver.flowscript.exception.NodeNotFoundException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.ir.NodeType;
import com.dcruver.flowscript.ir.RelationType;
import com.dcruver.flowscript.ir.Relationship;
import com.dcruver.flowscript.ir.State;
import com.dcruver.flowscript.ir.StateType;
import com.dcruver.flowscript.query.result.AlternativeOption;
import com.dcruver.flowscript.query.result.AlternativeTree;
import com.dcruver.flowscript.query.result.AlternativesReport;
import com.dcruver.flowscript.query.result.Blocker;
import com.dcruver.flowscript.query.result.BlockerReport;
import com.dcruver.flowscript.query.result.CausalAncestry;
import com.dcruver.flowscript.query.result.ChainLink;
import com.dcruver.flowscript.query.result.Consequence;
import com.dcruver.flowscript.query.result.DecisionSummary;
import com.dcruver.flowscript.query.result.ImpactAnalysis;
import com.dcruver.flowscript.query.result.NodeRef;
import com.dcruver.flowscript.query.result.Priority;
import com.dcruver.flowscript.query.result.TensionDetail;
import com.dcruver.flowscript.query.result.TensionRef;
import com.dcruver.flowscript.query.result.TensionReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only structural queries over one compiled graph.
 *
 * <p>{@link #load} builds the indexes once: nodes by id, states by node, and adjacency
 * bucketed by relationship type in both directions. Every query is pure and
 * visits each node at most once per traversal, so cycles are safe.
 */
@Slf4j
public class QueryEngine {

    private static final Set<RelationType> CAUSAL = EnumSet.of(RelationType.CAUSES, RelationType.DERIVES_FROM);
    private static final Set<RelationType> FORWARD_IMPACT =
        EnumSet.of(RelationType.CAUSES, RelationType.DERIVES_FROM, RelationType.TEMPORAL);
    private static final String UNLABELED_AXIS = "unlabeled";

    private enum Direction { INCOMING, OUTGOING }

    private final FlowGraph graph;
    private final Clock clock;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, List<State>> statesByNode = new HashMap<>();
    private final Map<RelationType, Map<String, List<Relationship>>> outgoing = new EnumMap<>(RelationType.class);
    private final Map<RelationType, Map<String, List<Relationship>>> incoming = new EnumMap<>(RelationType.class);
    private final Map<String, Set<String>> parents = new HashMap<>();
    private final Map<Relationship, Integer> documentOrder = new IdentityHashMap<>();

    private QueryEngine(FlowGraph graph, Clock clock) {
        this.graph = graph;
        this.clock = clock;
    }

    public static QueryEngine load(FlowGraph graph) {
        return load(graph, Clock.systemUTC());
    }

    /**
     * Index {@code graph}. Fails when an edge, state or child list references an unknown node.
     */
    public static QueryEngine load(FlowGraph graph, Clock clock) {
        QueryEngine engine = new QueryEngine(graph, clock);
        engine.buildIndexes();
        log.info("Query engine loaded: {} nodes, {} relationships, {} states",
            engine.nodes.size(), graph.getRelationships().size(), graph.getStates().size());
        return engine;
    }

    private void buildIndexes() {
        for (Node node : graph.getNodes()) {
            nodes.put(node.getId(), node);
        }
        for (RelationType type : RelationType.values()) {
            outgoing.put(type, new HashMap<>());
            incoming.put(type, new HashMap<>());
        }
        for (Relationship rel : graph.getRelationships()) {
            documentOrder.put(rel, documentOrder.size());
            requireReferenced(rel.getSource(), "Relationship " + rel.getId() + " references unknown source");
            requireReferenced(rel.getTarget(), "Relationship " + rel.getId() + " references unknown target");
            outgoing.get(rel.getType()).computeIfAbsent(rel.getSource(), k -> new ArrayList<>()).add(rel);
            incoming.get(rel.getType()).computeIfAbsent(rel.getTarget(), k -> new ArrayList<>()).add(rel);
        }
        for (State state : graph.getStates()) {
            requireReferenced(state.getNodeId(), "State " + state.getId() + " references unknown node");
            statesByNode.computeIfAbsent(state.getNodeId(), k -> new ArrayList<>()).add(state);
        }
        for (Node node : graph.getNodes()) {
            for (String childId : node.getChildren()) {
                requireReferenced(childId, "Node " + node.getId() + " lists unknown child");
                parents.computeIfAbsent(childId, k -> new LinkedHashSet<>()).add(node.getId());
            }
        }
    }

    private void requireReferenced(String id, String message) {
        if (id == null || !nodes.containsKey(id)) {
            throw new InvalidIrException(message + ": " + id, String.valueOf(id));
        }
    }

    // ---------------------------------------------------------------- why

    /**
     * Causal ancestry of a node: walk incoming causes and derives_from edges.
     */
    public CausalAncestry why(String nodeId, WhyOptions options) {
        Node target = require(nodeId);
        List<Visit> ancestors = traverse(nodeId, Direction.INCOMING, CAUSAL, options.getMaxDepth());

        List<NodeRef> rootCauses = ancestors.isEmpty()
            ? (neighbors(nodeId, Direction.INCOMING, CAUSAL).isEmpty() ? List.of(NodeRef.of(target)) : List.of())
            : ancestors.stream()
                .filter(v -> neighbors(v.node.getId(), Direction.INCOMING, CAUSAL).isEmpty())
                .map(v -> NodeRef.of(v.node))
                .collect(Collectors.toList());

        boolean multiplePaths = neighbors(nodeId, Direction.INCOMING, CAUSAL).size() > 1
            || ancestors.stream().anyMatch(v -> neighbors(v.node.getId(), Direction.INCOMING, CAUSAL).size() > 1);

        CausalAncestry.CausalAncestryBuilder result = CausalAncestry.builder()
            .format(options.getFormat())
            .target(NodeRef.of(target))
            .totalAncestors(ancestors.size())
            .maxDepthReached(ancestors.stream().mapToInt(v -> v.depth).max().orElse(0))
            .hasMultiplePaths(multiplePaths);

        switch (options.getFormat()) {
            case TREE:
                result.paths(ancestorPaths(nodeId, options.getMaxDepth())).rootCauses(rootCauses);
                break;
            case MINIMAL:
                result.ancestorIds(ancestors.stream().map(v -> v.node.getId()).collect(Collectors.toList()))
                    .rootCauseIds(rootCauses.stream().map(NodeRef::getId).collect(Collectors.toList()));
                break;
            case CHAIN:
            default:
                result.chain(ancestors.stream()
                        .map(v -> new ChainLink(v.depth, NodeRef.of(v.node), v.via))
                        .collect(Collectors.toList()))
                    .rootCauses(rootCauses);
                break;
        }

        log.debug("why({}) found {} ancestors", nodeId, ancestors.size());
        return result.build();
    }

    private List<List<NodeRef>> ancestorPaths(String nodeId, Integer maxDepth) {
        List<List<NodeRef>> paths = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        collectPaths(nodeId, maxDepth, path, paths);
        return paths;
    }

    private void collectPaths(String nodeId, Integer maxDepth, Deque<String> path, List<List<NodeRef>> paths) {
        path.addLast(nodeId);
        List<String> causes = neighbors(nodeId, Direction.INCOMING, CAUSAL).stream()
            .filter(id -> !path.contains(id))
            .collect(Collectors.toList());
        boolean atLimit = maxDepth != null && path.size() - 1 >= maxDepth;

        if (causes.isEmpty() || atLimit) {
            if (path.size() > 1) {
                paths.add(path.stream().map(id -> NodeRef.of(nodes.get(id))).collect(Collectors.toList()));
            }
        } else {
            for (String cause : causes) {
                collectPaths(cause, maxDepth, path, paths);
            }
        }
        path.removeLast();
    }

    // ---------------------------------------------------------------- what if

    /**
     * Forward impact of a node over causal and, optionally, temporal edges.
     */
    public ImpactAnalysis whatIf(String nodeId, WhatIfOptions options) {
        Node source = require(nodeId);
        Set<RelationType> types = options.isIncludeTemporal() ? FORWARD_IMPACT : CAUSAL;
        List<Visit> descendants = traverse(nodeId, Direction.OUTGOING, types, options.getMaxDepth());

        Set<String> zone = new HashSet<>();
        zone.add(nodeId);
        descendants.forEach(v -> zone.add(v.node.getId()));
        List<TensionRef> zoneTensions = graph.getRelationships().stream()
            .filter(r -> r.is(RelationType.TENSION))
            .filter(r -> zone.contains(r.getSource()) || zone.contains(r.getTarget()))
            .map(this::tensionRef)
            .collect(Collectors.toList());

        List<Consequence> consequences = descendants.stream()
            .map(v -> new Consequence(v.depth, NodeRef.of(v.node), v.via, touchesTension(v.node.getId())))
            .collect(Collectors.toList());

        ImpactAnalysis.ImpactAnalysisBuilder result = ImpactAnalysis.builder()
            .format(options.getFormat())
            .source(NodeRef.of(source))
            .totalDescendants(descendants.size())
            .maxDepthReached(descendants.stream().mapToInt(v -> v.depth).max().orElse(0))
            .hasTemporalConsequences(descendants.stream().anyMatch(v -> v.via == RelationType.TEMPORAL));

        switch (options.getFormat()) {
            case LIST:
                result.consequences(consequences);
                break;
            case SUMMARY: {
                List<String> benefits = new ArrayList<>();
                List<String> risks = new ArrayList<>();
                for (Consequence c : consequences) {
                    if (c.getDepth() == 1) {
                        (c.isInTension() ? risks : benefits).add(c.getNode().getContent());
                    }
                }
                long direct = consequences.stream().filter(c -> c.getDepth() == 1).count();
                result.benefits(benefits)
                    .risks(risks)
                    .keyTradeoff(zoneTensions.isEmpty() ? null : zoneTensions.get(0).getAxis())
                    .impactSummary(String.format(
                        "Changing \"%s\" affects %d node(s): %d direct, %d indirect; %d tension(s) in the impact zone",
                        source.getContent(), consequences.size(), direct, consequences.size() - direct,
                        zoneTensions.size()));
                break;
            }
            case TREE:
            default:
                result.directConsequences(consequences.stream().filter(c -> c.getDepth() == 1).collect(Collectors.toList()))
                    .indirectConsequences(consequences.stream().filter(c -> c.getDepth() > 1).collect(Collectors.toList()))
                    .tensionsInImpactZone(zoneTensions);
                break;
        }
        return result.build();
    }

    private boolean touchesTension(String nodeId) {
        return !outgoing.get(RelationType.TENSION).getOrDefault(nodeId, List.of()).isEmpty()
            || !incoming.get(RelationType.TENSION).getOrDefault(nodeId, List.of()).isEmpty();
    }

    // ---------------------------------------------------------------- tensions

    public TensionReport tensions(TensionOptions options) {
        Set<String> scope = options.getScope() == null ? null : reachableFrom(require(options.getScope()).getId());

        List<TensionDetail> details = new ArrayList<>();
        for (Relationship rel : graph.getRelationships()) {
            if (!rel.is(RelationType.TENSION)) {
                continue;
            }
            if (scope != null && !(scope.contains(rel.getSource()) && scope.contains(rel.getTarget()))) {
                continue;
            }
            String axis = axisOf(rel);
            if (options.getFilterByAxis() != null && !axis.equalsIgnoreCase(options.getFilterByAxis())) {
                continue;
            }
            details.add(new TensionDetail(rel.getId(), axis,
                NodeRef.of(nodes.get(rel.getSource())), NodeRef.of(nodes.get(rel.getTarget())),
                options.isIncludeContext() ? contextOf(rel.getSource()) : null));
        }

        Map<String, Integer> axisCounts = new LinkedHashMap<>();
        details.forEach(d -> axisCounts.merge(d.getAxis(), 1, Integer::sum));
        String mostCommon = null;
        int best = 0;
        for (Map.Entry<String, Integer> e : axisCounts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                mostCommon = e.getKey();
            }
        }

        TensionReport.TensionReportBuilder report = TensionReport.builder()
            .groupBy(options.getGroupBy())
            .totalTensions(details.size())
            .uniqueAxes(new ArrayList<>(axisCounts.keySet()))
            .mostCommonAxis(mostCommon);

        switch (options.getGroupBy()) {
            case NODE:
                report.tensionsByNode(details.stream().collect(Collectors.groupingBy(
                    d -> d.getSource().getContent(), LinkedHashMap::new, Collectors.toList())));
                break;
            case NONE:
                report.tensions(details);
                break;
            case AXIS:
            default:
                report.tensionsByAxis(details.stream().collect(Collectors.groupingBy(
                    TensionDetail::getAxis, LinkedHashMap::new, Collectors.toList())));
                break;
        }
        return report.build();
    }

    /**
     * Nodes reachable from {@code startId} over any outgoing edge or child link, including itself
     */
    private Set<String> reachableFrom(String startId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            for (Map<String, List<Relationship>> bucket : outgoing.values()) {
                bucket.getOrDefault(id, List.of()).forEach(r -> queue.add(r.getTarget()));
            }
            queue.addAll(nodes.get(id).getChildren());
        }
        return seen;
    }

    private List<NodeRef> contextOf(String nodeId) {
        Set<String> context = new LinkedHashSet<>(parents.getOrDefault(nodeId, Set.of()));
        incoming.forEach((type, bucket) -> {
            if (type != RelationType.TENSION) {
                bucket.getOrDefault(nodeId, List.of()).forEach(r -> context.add(r.getSource()));
            }
        });
        return context.stream().map(id -> NodeRef.of(nodes.get(id))).collect(Collectors.toList());
    }

    // ---------------------------------------------------------------- blocked

    /**
     * Every blocked node with its age, its causes and what it holds up, highest impact first.
     */
    public BlockerReport blocked(BlockedOptions options) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<Blocker> blockers = new ArrayList<>();

        for (State state : graph.getStates()) {
            if (state.getType() != StateType.BLOCKED) {
                continue;
            }
            String since = state.field("since");
            LocalDate sinceDate = parseDate(since);
            if (options.getSince() != null && (sinceDate == null || sinceDate.isBefore(options.getSince()))) {
                continue;
            }

            Node node = nodes.get(state.getNodeId());
            int days = sinceDate == null ? 0 : (int) Math.max(0, ChronoUnit.DAYS.between(sinceDate, today));
            List<NodeRef> causes = refs(traverse(node.getId(), Direction.INCOMING, CAUSAL, null));
            List<NodeRef> effects = refs(traverse(node.getId(), Direction.OUTGOING, FORWARD_IMPACT, null));
            int score = days + causes.size() + 2 * effects.size();

            Blocker.BlockerBuilder blocker = Blocker.builder()
                .node(NodeRef.of(node))
                .daysBlocked(days)
                .impactScore(score)
                .priority(Priority.forScore(score));
            if (options.getFormat() != BlockedOptions.Format.LIST) {
                blocker.reason(state.field("reason"))
                    .since(since)
                    .causeCount(causes.size())
                    .effectCount(effects.size());
            }
            if (options.getFormat() == BlockedOptions.Format.DETAILED) {
                blocker.transitiveCauses(causes).transitiveEffects(effects);
            }
            blockers.add(blocker.build());
        }

        blockers.sort(Comparator.comparingInt(Blocker::getImpactScore)
            .thenComparingInt(Blocker::getDaysBlocked)
            .reversed());

        Blocker oldest = blockers.stream().max(Comparator.comparingInt(Blocker::getDaysBlocked)).orElse(null);
        double average = blockers.stream().mapToInt(Blocker::getDaysBlocked).average().orElse(0);

        return BlockerReport.builder()
            .format(options.getFormat())
            .blockers(blockers)
            .totalBlockers(blockers.size())
            .highPriorityCount((int) blockers.stream().filter(b -> b.getPriority() == Priority.HIGH).count())
            .averageDaysBlocked(Math.round(average * 10) / 10.0)
            .oldestBlocker(oldest == null ? null : oldest.getNode())
            .oldestDaysBlocked(oldest == null ? 0 : oldest.getDaysBlocked())
            .build();
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.trim()).atZone(ZoneOffset.UTC).toLocalDate();
            } catch (DateTimeParseException notAnInstant) {
                log.warn("Unparseable blocked since date '{}', counting 0 days", value);
                return null;
            }
        }
    }

    // ---------------------------------------------------------------- alternatives

    /**
     * Reconstruct the decision around a question from its alternatives and decided states.
     */
    public AlternativesReport alternatives(String questionId, AlternativesOptions options) {
        Node question = require(questionId);
        if (!question.is(NodeType.QUESTION)) {
            throw new InvalidNodeTypeException(questionId, NodeType.QUESTION.wireName(), question.getType().wireName());
        }

        Map<String, State> decidedByContent = new HashMap<>();
        for (State state : graph.getStates()) {
            if (state.getType() == StateType.DECIDED) {
                decidedByContent.putIfAbsent(nodes.get(state.getNodeId()).getContent(), state);
            }
        }

        List<Node> alternatives = alternativesOf(question);
        AlternativesReport.AlternativesReportBuilder report = AlternativesReport.builder()
            .format(options.getFormat())
            .question(NodeRef.of(question));

        switch (options.getFormat()) {
            case SIMPLE: {
                Node chosen = alternatives.stream()
                    .filter(a -> decidedByContent.containsKey(a.getContent()))
                    .findFirst()
                    .orElse(null);
                report.optionsConsidered(alternatives.stream().map(Node::getContent).collect(Collectors.toList()))
                    .chosen(chosen == null ? null : chosen.getContent())
                    .reason(chosen == null ? null : decidedByContent.get(chosen.getContent()).field("rationale"));
                break;
            }
            case TREE:
                report.tree(alternatives.stream()
                    .map(a -> consequenceTree(a, decidedByContent.containsKey(a.getContent()),
                        new LinkedHashSet<>(), options.getMaxDepth()))
                    .collect(Collectors.toList()));
                break;
            case COMPARISON:
            default: {
                List<AlternativeOption> compared = alternatives.stream()
                    .map(a -> compare(a, decidedByContent.get(a.getContent()), options.isShowRejectedReasons()))
                    .collect(Collectors.toList());
                report.alternatives(compared).decisionSummary(summarize(compared));
                break;
            }
        }
        return report.build();
    }

    private List<Node> alternativesOf(Node question) {
        Set<String> ids = new LinkedHashSet<>();
        outgoing.get(RelationType.ALTERNATIVE).getOrDefault(question.getId(), List.of())
            .forEach(r -> ids.add(r.getTarget()));
        for (String childId : question.getChildren()) {
            if (nodes.get(childId).is(NodeType.ALTERNATIVE)) {
                ids.add(childId);
            }
        }
        return ids.stream().map(nodes::get).collect(Collectors.toList());
    }

    private AlternativeOption compare(Node alternative, State decided, boolean showRejectedReasons) {
        String id = alternative.getId();
        List<TensionRef> tensions = new ArrayList<>();
        outgoing.get(RelationType.TENSION).getOrDefault(id, List.of()).forEach(r -> tensions.add(tensionRef(r)));
        incoming.get(RelationType.TENSION).getOrDefault(id, List.of()).forEach(r -> tensions.add(tensionRef(r)));

        AlternativeOption.AlternativeOptionBuilder option = AlternativeOption.builder()
            .node(NodeRef.of(alternative))
            .chosen(decided != null)
            .consequences(outgoing.get(RelationType.CAUSES).getOrDefault(id, List.of()).stream()
                .map(r -> nodes.get(r.getTarget()).getContent())
                .collect(Collectors.toList()))
            .tensions(tensions);

        if (decided != null) {
            option.rationale(decided.field("rationale")).decidedOn(decided.field("on"));
        } else if (showRejectedReasons) {
            option.rejectionReasons(rejectionReasons(alternative));
        }
        return option.build();
    }

    /**
     * Thoughts nested under, or caused by, an alternative
     */
    private List<String> rejectionReasons(Node alternative) {
        Set<String> candidates = new LinkedHashSet<>(alternative.getChildren());
        outgoing.get(RelationType.CAUSES).getOrDefault(alternative.getId(), List.of())
            .forEach(r -> candidates.add(r.getTarget()));
        return candidates.stream()
            .map(nodes::get)
            .filter(n -> n.is(NodeType.THOUGHT))
            .map(Node::getContent)
            .collect(Collectors.toList());
    }

    private static DecisionSummary summarize(List<AlternativeOption> compared) {
        AlternativeOption chosen = compared.stream().filter(AlternativeOption::isChosen).findFirst().orElse(null);
        List<AlternativeOption> factorSource = chosen == null ? compared : List.of(chosen);
        List<String> keyFactors = factorSource.stream()
            .flatMap(o -> o.getTensions().stream())
            .map(TensionRef::getAxis)
            .distinct()
            .collect(Collectors.toList());

        return DecisionSummary.builder()
            .chosen(chosen == null ? null : chosen.getNode().getContent())
            .rationale(chosen == null ? null : chosen.getRationale())
            .rejected(compared.stream()
                .filter(o -> !o.isChosen())
                .map(o -> o.getNode().getContent())
                .collect(Collectors.toList()))
            .keyFactors(keyFactors)
            .build();
    }

    private AlternativeTree consequenceTree(Node node, boolean chosen, Set<String> path, int depthLeft) {
        if (path.contains(node.getId())) {
            return new AlternativeTree(NodeRef.of(node), chosen, true, List.of());
        }
        if (depthLeft <= 0) {
            return new AlternativeTree(NodeRef.of(node), chosen, false, List.of());
        }
        path.add(node.getId());
        Set<String> next = new LinkedHashSet<>();
        outgoing.get(RelationType.CAUSES).getOrDefault(node.getId(), List.of()).forEach(r -> next.add(r.getTarget()));
        next.addAll(node.getChildren());
        List<AlternativeTree> children = next.stream()
            .map(id -> consequenceTree(nodes.get(id), false, path, depthLeft - 1))
            .collect(Collectors.toList());
        path.remove(node.getId());
        return new AlternativeTree(NodeRef.of(node), chosen, false, children);
    }

    // ---------------------------------------------------------------- traversal

    private Node require(String nodeId) {
        Node node = nodeId == null ? null : nodes.get(nodeId);
        if (node == null) {
            throw new NodeNotFoundException(String.valueOf(nodeId));
        }
        return node;
    }

    /**
     * Breadth-first walk from {@code startId}; each node is reported once, at its minimal depth.
     * The start node itself is never reported.
     */
    private List<Visit> traverse(String startId, Direction direction, Set<RelationType> types, Integer maxDepth) {
        List<Visit> visits = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(startId);
        Deque<Visit> queue = new ArrayDeque<>();
        queue.add(new Visit(nodes.get(startId), 0, null));

        while (!queue.isEmpty()) {
            Visit current = queue.poll();
            if (maxDepth != null && current.depth >= maxDepth) {
                continue;
            }
            for (Relationship rel : edges(current.node.getId(), direction, types)) {
                String nextId = direction == Direction.INCOMING ? rel.getSource() : rel.getTarget();
                if (visited.add(nextId)) {
                    Visit visit = new Visit(nodes.get(nextId), current.depth + 1, rel.getType());
                    visits.add(visit);
                    queue.add(visit);
                }
            }
        }
        return visits;
    }

    private List<Relationship> edges(String nodeId, Direction direction, Set<RelationType> types) {
        Map<RelationType, Map<String, List<Relationship>>> index = direction == Direction.INCOMING ? incoming : outgoing;
        List<Relationship> edges = new ArrayList<>();
        for (RelationType type : types) {
            edges.addAll(index.get(type).getOrDefault(nodeId, List.of()));
        }
        edges.sort(Comparator.comparingInt(documentOrder::get));
        return edges;
    }

    private List<String> neighbors(String nodeId, Direction direction, Set<RelationType> types) {
        return edges(nodeId, direction, types).stream()
            .map(r -> direction == Direction.INCOMING ? r.getSource() : r.getTarget())
            .distinct()
            .collect(Collectors.toList());
    }

    private List<NodeRef> refs(List<Visit> visits) {
        return Collections.unmodifiableList(visits.stream().map(v -> NodeRef.of(v.node)).collect(Collectors.toList()));
    }

    private TensionRef tensionRef(Relationship rel) {
        return new TensionRef(axisOf(rel), NodeRef.of(nodes.get(rel.getSource())), NodeRef.of(nodes.get(rel.getTarget())));
    }

    private static String axisOf(Relationship rel) {
        return rel.hasAxisLabel() ? rel.getAxisLabel() : UNLABELED_AXIS;
    }

    private static final class Visit {
        private final Node node;
        private final int depth;
        private final RelationType via;

        private Visit(Node node, int depth, RelationType via) {
            this.node = node;
            this.depth = depth;
            this.via = via;
        }
    }
}
