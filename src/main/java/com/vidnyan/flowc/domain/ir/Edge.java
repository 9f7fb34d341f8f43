package com.vidnyan.flowc.domain.ir;

/**
 * Directed connection from an output anchor to an input anchor.
 */
public record Edge(
    String id,
    String sourceNodeId,
    String sourceAnchorId,
    String targetNodeId,
    String targetAnchorId
) {

    /**
     * Format as readable string.
     */
    public String format() {
        return sourceNodeId + ":" + sourceAnchorId + " -> " + targetNodeId + ":" + targetAnchorId;
    }
}
