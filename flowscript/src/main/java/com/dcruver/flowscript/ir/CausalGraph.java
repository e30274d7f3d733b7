package com.dcruver.flowscript.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency view over the causal edges of a graph (causes and derives_from,
 * minus edges flagged as feedback), oriented cause to effect.
 */
public class CausalGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, List<String>> successors = new LinkedHashMap<>();

    private final List<List<String>> cycles = new ArrayList<>();
    private final Set<String> backEdges = new HashSet<>();
    private boolean analyzed;

    private CausalGraph() {
    }

    public static CausalGraph of(FlowGraph graph) {
        return of(graph.getRelationships());
    }

    public static CausalGraph of(List<Relationship> relationships) {
        CausalGraph causal = new CausalGraph();
        for (Relationship rel : relationships) {
            if (!rel.getType().isCausal() || rel.isFeedback()) {
                continue;
            }
            causal.successors.computeIfAbsent(rel.getSource(), k -> new ArrayList<>()).add(rel.getTarget());
            causal.successors.computeIfAbsent(rel.getTarget(), k -> new ArrayList<>());
        }
        return causal;
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    /**
     * Every cycle closed by a DFS back edge, as the node sequence around the loop
     * with the first node repeated at the end.
     */
    public List<List<String>> findCycles() {
        analyze();
        return Collections.unmodifiableList(cycles);
    }

    /**
     * For each entry point, the longest chain of nodes that starts there. Back edges are ignored,
     * so cycles do not make chains infinite, and a node entered only through a back edge counts
     * as an entry point. Chains that start inside a cycle are therefore still covered.
     */
    public Map<String, List<String>> longestChainsFromRoots() {
        analyze();
        Set<String> entered = new HashSet<>();
        successors.forEach((from, targets) -> {
            for (String to : targets) {
                if (!backEdges.contains(edgeKey(from, to))) {
                    entered.add(to);
                }
            }
        });

        Map<String, List<String>> memo = new HashMap<>();
        Map<String, List<String>> chains = new LinkedHashMap<>();
        for (String id : successors.keySet()) {
            if (entered.contains(id)) {
                continue;
            }
            List<String> chain = longestFrom(id, memo);
            if (chain.size() > 1) {
                chains.put(id, chain);
            }
        }
        return chains;
    }

    private List<String> longestFrom(String id, Map<String, List<String>> memo) {
        List<String> cached = memo.get(id);
        if (cached != null) {
            return cached;
        }
        List<String> best = List.of();
        for (String next : successors.get(id)) {
            if (backEdges.contains(edgeKey(id, next))) {
                continue;
            }
            List<String> candidate = longestFrom(next, memo);
            if (candidate.size() > best.size()) {
                best = candidate;
            }
        }
        List<String> chain = new ArrayList<>(best.size() + 1);
        chain.add(id);
        chain.addAll(best);
        List<String> result = Collections.unmodifiableList(chain);
        memo.put(id, result);
        return result;
    }

    private void analyze() {
        if (analyzed) {
            return;
        }
        analyzed = true;
        Map<String, Color> colors = new HashMap<>();
        Set<String> seenCycles = new LinkedHashSet<>();
        for (String id : successors.keySet()) {
            if (colors.getOrDefault(id, Color.WHITE) == Color.WHITE) {
                dfs(id, colors, new ArrayList<>(), seenCycles);
            }
        }
    }

    private void dfs(String id, Map<String, Color> colors, List<String> stack, Set<String> seenCycles) {
        colors.put(id, Color.GRAY);
        stack.add(id);

        for (String next : successors.get(id)) {
            Color color = colors.getOrDefault(next, Color.WHITE);
            if (color == Color.WHITE) {
                dfs(next, colors, stack, seenCycles);
            } else if (color == Color.GRAY) {
                backEdges.add(edgeKey(id, next));
                List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                if (seenCycles.add(canonicalKey(cycle))) {
                    cycles.add(Collections.unmodifiableList(cycle));
                }
            }
        }

        stack.remove(stack.size() - 1);
        colors.put(id, Color.BLACK);
    }

    /** Same loop entered at a different node is the same cycle */
    private static String canonicalKey(List<String> cycle) {
        List<String> loop = cycle.subList(0, cycle.size() - 1);
        int start = loop.indexOf(Collections.min(loop));
        List<String> rotated = new ArrayList<>(loop.subList(start, loop.size()));
        rotated.addAll(loop.subList(0, start));
        return String.join(">", rotated);
    }

    private static String edgeKey(String from, String to) {
        return from + "\u0000" + to;
    }
}
