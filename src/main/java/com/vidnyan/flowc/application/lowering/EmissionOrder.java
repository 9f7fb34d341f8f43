package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.domain.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Order in which nodes are lowered and emitted.
 * Topological over the dependency graph with document-order tie-break; nodes on a cycle
 * cannot be ordered and keep their document order inside the cycle (the fallback nodes).
 */
public record EmissionOrder(List<String> nodeIds, Set<String> fallbackNodeIds) {

    public EmissionOrder {
        nodeIds = List.copyOf(nodeIds);
        fallbackNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(fallbackNodeIds));
    }

    /**
     * Kahn's algorithm over the condensation of strongly connected components.
     * Ready components are taken by the smallest document index they contain.
     */
    public static EmissionOrder compute(DependencyGraph graph) {
        List<List<String>> components = graph.stronglyConnectedComponents();
        Map<String, Integer> componentOf = new HashMap<>();
        for (int c = 0; c < components.size(); c++) {
            for (String node : components.get(c)) {
                componentOf.put(node, c);
            }
        }

        int[] inDegree = new int[components.size()];
        List<Set<Integer>> downstream = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            downstream.add(new LinkedHashSet<>());
        }
        for (String node : graph.nodes()) {
            int from = componentOf.get(node);
            for (String successor : graph.getSuccessors(node)) {
                int to = componentOf.get(successor);
                if (from != to && downstream.get(from).add(to)) {
                    inDegree[to]++;
                }
            }
        }

        // components are sorted by document index, so the head is the minimum
        PriorityQueue<Integer> ready = new PriorityQueue<>(
                Comparator.comparingInt(c -> graph.documentIndex(components.get(c).get(0))));
        for (int c = 0; c < components.size(); c++) {
            if (inDegree[c] == 0) {
                ready.add(c);
            }
        }

        List<String> order = new ArrayList<>(graph.nodes().size());
        Set<String> fallback = new LinkedHashSet<>();
        while (!ready.isEmpty()) {
            int c = ready.poll();
            List<String> component = components.get(c);
            order.addAll(component);
            if (graph.isCyclic(component)) {
                fallback.addAll(component);
            }
            for (int next : downstream.get(c)) {
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }
        return new EmissionOrder(order, fallback);
    }

    public int indexOf(String nodeId) {
        return nodeIds.indexOf(nodeId);
    }

    public boolean hasFallback() {
        return !fallbackNodeIds.isEmpty();
    }

    public int size() {
        return nodeIds.size();
    }
}
