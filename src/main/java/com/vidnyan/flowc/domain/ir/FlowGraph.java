package com.vidnyan.flowc.domain.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The intermediate representation of a flow: nodes in document order plus edges.
 * May represent an invalid graph so the analyzer can report why. Immutable.
 */
public final class FlowGraph {

    private final String name;
    private final Map<String, IrNode> nodes;
    private final List<Edge> edges;
    private final Set<String> duplicateNodeIds;
    private final Map<String, Integer> documentIndex;
    private final Map<String, List<Edge>> incoming;
    private final Map<String, List<Edge>> outgoing;

    private FlowGraph(String name, Map<String, IrNode> nodes, List<Edge> edges, Set<String> duplicateNodeIds) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.duplicateNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(duplicateNodeIds));

        Map<String, Integer> index = new HashMap<>();
        int i = 0;
        for (String id : nodes.keySet()) {
            index.put(id, i++);
        }
        this.documentIndex = Collections.unmodifiableMap(index);

        Map<String, List<Edge>> in = new HashMap<>();
        Map<String, List<Edge>> out = new HashMap<>();
        for (Edge edge : this.edges) {
            out.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.targetNodeId(), k -> new ArrayList<>()).add(edge);
        }
        this.incoming = Collections.unmodifiableMap(in);
        this.outgoing = Collections.unmodifiableMap(out);
    }

    /**
     * Build a graph from nodes in document order.
     * Later nodes that repeat an id are dropped and their id remembered.
     */
    public static FlowGraph of(String name, List<IrNode> nodes, List<Edge> edges) {
        Map<String, IrNode> byId = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (IrNode node : nodes) {
            if (byId.containsKey(node.id())) {
                duplicates.add(node.id());
            } else {
                byId.put(node.id(), node);
            }
        }
        return new FlowGraph(name, byId, edges, duplicates);
    }

    public static FlowGraph of(List<IrNode> nodes, List<Edge> edges) {
        return of("flow", nodes, edges);
    }

    public String name() {
        return name;
    }

    /**
     * Nodes keyed by id, iteration in document order.
     */
    public Map<String, IrNode> nodes() {
        return nodes;
    }

    public List<IrNode> nodeList() {
        return List.copyOf(nodes.values());
    }

    public List<Edge> edges() {
        return edges;
    }

    public Set<String> duplicateNodeIds() {
        return duplicateNodeIds;
    }

    public Optional<IrNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Position of the node in the document; the tie-break for every deterministic sort.
     */
    public int documentIndex(String nodeId) {
        return documentIndex.getOrDefault(nodeId, Integer.MAX_VALUE);
    }

    public List<Edge> incomingEdges(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public List<Edge> outgoingEdges(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /**
     * Edges arriving at a specific input anchor, in edge order.
     */
    public List<Edge> incomingEdges(String nodeId, String anchorId) {
        return incomingEdges(nodeId).stream()
                .filter(e -> anchorId.equals(e.targetAnchorId()))
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
