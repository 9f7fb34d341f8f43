package com.vidnyan.flowc.domain.analysis;

import java.util.List;
import java.util.Map;

/**
 * Shape statistics of a flow graph.
 */
public record GraphStats(
    int nodeCount,
    int edgeCount,
    double averageDegree,
    Map<String, Integer> nodeTypes,
    Map<String, Integer> categories,
    List<String> entryPoints,
    List<String> exitPoints,
    List<String> isolatedNodes
) {

    public static GraphStats empty() {
        return new GraphStats(0, 0, 0.0, Map.of(), Map.of(), List.of(), List.of(), List.of());
    }
}
