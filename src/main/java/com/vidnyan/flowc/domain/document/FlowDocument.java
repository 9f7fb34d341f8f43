package com.vidnyan.flowc.domain.document;

import java.util.List;
import java.util.Map;

/**
 * A parsed flow document as exported by the visual editor.
 * Shapes only; no validity guarantees beyond what the JSON carried.
 */
public record FlowDocument(
    String name,
    List<NodeEntry> nodes,
    List<EdgeEntry> edges
) {

    public FlowDocument {
        nodes = nodes != null ? nodes : List.of();
        edges = edges != null ? edges : List.of();
    }

    /**
     * One node on the canvas. Position is carried for completeness and never read by the compiler.
     */
    public record NodeEntry(
        String id,
        String type,
        Position position,
        NodeData data
    ) {}

    public record Position(double x, double y) {}

    /**
     * The node payload: identity, declared anchors, declared parameters and the user-edited inputs.
     */
    public record NodeData(
        String id,
        String label,
        String name,
        String type,
        String category,
        Object version,
        List<InputParam> inputParams,
        List<AnchorEntry> inputAnchors,
        List<AnchorEntry> outputAnchors,
        Map<String, Object> inputs
    ) {}

    public record InputParam(
        String name,
        String label,
        String type,
        Boolean optional,
        Object defaultValue
    ) {}

    public record AnchorEntry(
        String id,
        String name,
        String label,
        String type,
        Boolean optional,
        Boolean list
    ) {}

    public record EdgeEntry(
        String id,
        String source,
        String sourceHandle,
        String target,
        String targetHandle
    ) {}
}
