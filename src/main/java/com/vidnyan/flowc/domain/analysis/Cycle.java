package com.vidnyan.flowc.domain.analysis;

import java.util.List;

/**
 * A directed cycle as a node-id path that starts and ends on the same node.
 */
public record Cycle(List<String> path) {

    public Cycle {
        path = List.copyOf(path);
    }

    /**
     * Distinct nodes on the cycle, first occurrence order.
     */
    public List<String> nodes() {
        return path.size() > 1 ? path.subList(0, path.size() - 1) : path;
    }

    public String format() {
        return String.join(" → ", path);
    }
}
