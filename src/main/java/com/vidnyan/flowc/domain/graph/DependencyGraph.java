package com.vidnyan.flowc.domain.graph;

import com.vidnyan.flowc.domain.ir.Edge;
import com.vidnyan.flowc.domain.ir.FlowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node-level dependency view of a flow: producer -> consumer.
 * Only edges whose endpoints both resolve to nodes take part. Immutable and thread-safe.
 */
public final class DependencyGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final List<String> nodes;                  // document order
    private final Map<String, List<String>> successors; // distinct targets, edge order
    private final Map<String, List<String>> predecessors;
    private final Map<String, Integer> documentIndex;

    private DependencyGraph(
            List<String> nodes,
            Map<String, List<String>> successors,
            Map<String, List<String>> predecessors,
            Map<String, Integer> documentIndex
    ) {
        this.nodes = List.copyOf(nodes);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.documentIndex = Collections.unmodifiableMap(documentIndex);
    }

    /**
     * Build dependency graph from the IR.
     */
    public static DependencyGraph build(FlowGraph graph) {
        List<String> nodeIds = new ArrayList<>(graph.nodes().keySet());
        Map<String, Integer> index = new HashMap<>();
        Map<String, Set<String>> succ = new LinkedHashMap<>();
        Map<String, Set<String>> pred = new LinkedHashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            index.put(nodeIds.get(i), i);
            succ.put(nodeIds.get(i), new LinkedHashSet<>());
            pred.put(nodeIds.get(i), new LinkedHashSet<>());
        }

        for (Edge edge : graph.edges()) {
            if (graph.containsNode(edge.sourceNodeId()) && graph.containsNode(edge.targetNodeId())) {
                succ.get(edge.sourceNodeId()).add(edge.targetNodeId());
                pred.get(edge.targetNodeId()).add(edge.sourceNodeId());
            }
        }

        Map<String, List<String>> successors = new HashMap<>();
        succ.forEach((k, v) -> successors.put(k, List.copyOf(v)));
        Map<String, List<String>> predecessors = new HashMap<>();
        pred.forEach((k, v) -> {
            List<String> sorted = new ArrayList<>(v);
            sorted.sort(Comparator.comparingInt(index::get));
            predecessors.put(k, List.copyOf(sorted));
        });

        return new DependencyGraph(nodeIds, successors, predecessors, index);
    }

    public List<String> nodes() {
        return nodes;
    }

    public List<String> getSuccessors(String nodeId) {
        return successors.getOrDefault(nodeId, List.of());
    }

    /**
     * Direct producers of a node, in document order.
     */
    public List<String> getPredecessors(String nodeId) {
        return predecessors.getOrDefault(nodeId, List.of());
    }

    public int documentIndex(String nodeId) {
        return documentIndex.getOrDefault(nodeId, Integer.MAX_VALUE);
    }

    /**
     * Find cycles with an iterative three-color DFS.
     * Every back-edge yields one path from the repeated node back to itself, e.g. [A, B, A].
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Map<String, Color> color = new HashMap<>();
        nodes.forEach(n -> color.put(n, Color.WHITE));

        for (String start : nodes) {
            if (color.get(start) != Color.WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(start));
            color.put(start, Color.GRAY);
            path.add(start);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> next = getSuccessors(frame.node);
                if (frame.position < next.size()) {
                    String target = next.get(frame.position++);
                    Color state = color.get(target);
                    if (state == Color.WHITE) {
                        color.put(target, Color.GRAY);
                        stack.push(new Frame(target));
                        path.add(target);
                    } else if (state == Color.GRAY) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                        cycle.add(target);
                        cycles.add(List.copyOf(cycle));
                    }
                } else {
                    color.put(frame.node, Color.BLACK);
                    stack.pop();
                    path.remove(path.size() - 1);
                }
            }
        }
        return cycles;
    }

    /**
     * Strongly connected components (iterative Tarjan).
     * Each component lists its nodes in document order; components come back in discovery order.
     */
    public List<List<String>> stronglyConnectedComponents() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String start : nodes) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<Frame> callStack = new ArrayDeque<>();
            index.put(start, counter);
            lowLink.put(start, counter++);
            stack.push(start);
            onStack.add(start);
            callStack.push(new Frame(start));

            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                String v = frame.node;
                List<String> next = getSuccessors(v);
                if (frame.position < next.size()) {
                    String w = next.get(frame.position++);
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        lowLink.put(w, counter++);
                        stack.push(w);
                        onStack.add(w);
                        callStack.push(new Frame(w));
                    } else if (onStack.contains(w)) {
                        lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                    }
                    continue;
                }

                callStack.pop();
                if (lowLink.get(v).equals(index.get(v))) {
                    List<String> component = new ArrayList<>();
                    String w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        component.add(w);
                    } while (!w.equals(v));
                    component.sort(Comparator.comparingInt(this::documentIndex));
                    components.add(List.copyOf(component));
                }
                if (!callStack.isEmpty()) {
                    String parent = callStack.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(v)));
                }
            }
        }
        return components;
    }

    /**
     * True when the component cannot be ordered: more than one node, or a node feeding itself.
     */
    public boolean isCyclic(List<String> component) {
        if (component.size() > 1) {
            return true;
        }
        String only = component.get(0);
        return getSuccessors(only).contains(only);
    }

    private static final class Frame {
        private final String node;
        private int position;

        private Frame(String node) {
            this.node = node;
        }
    }
}
