package com.vidnyan.flowc.domain.analysis;

import java.util.List;

/**
 * Which node types of a graph have a registered converter.
 * Type lists keep first-occurrence order in the document and contain no duplicates.
 */
public record CoverageReport(
    int totalNodeCount,
    int supportedNodeCount,
    List<String> supportedTypes,
    List<String> unsupportedTypes
) {

    public CoverageReport {
        supportedTypes = List.copyOf(supportedTypes);
        unsupportedTypes = List.copyOf(unsupportedTypes);
    }

    public static CoverageReport empty() {
        return new CoverageReport(0, 0, List.of(), List.of());
    }

    /**
     * supportedNodeCount / totalNodeCount; an empty graph is fully covered.
     */
    public double coverage() {
        return totalNodeCount == 0 ? 1.0 : (double) supportedNodeCount / totalNodeCount;
    }

    /**
     * Fraction of distinct node types that are supported.
     */
    public double typeCoverage() {
        int distinct = supportedTypes.size() + unsupportedTypes.size();
        return distinct == 0 ? 1.0 : (double) supportedTypes.size() / distinct;
    }

    public boolean isComplete() {
        return unsupportedTypes.isEmpty();
    }
}
