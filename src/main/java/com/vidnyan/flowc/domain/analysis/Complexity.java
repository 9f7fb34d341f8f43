package com.vidnyan.flowc.domain.analysis;

/**
 * Coarse size signal for callers. Not used inside the pipeline.
 */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    private static final int SIMPLE_LIMIT = 5;
    private static final int MODERATE_LIMIT = 15;

    public static Complexity classify(int nodeCount, int edgeCount) {
        int size = nodeCount + edgeCount;
        if (size <= SIMPLE_LIMIT) return SIMPLE;
        if (size <= MODERATE_LIMIT) return MODERATE;
        return COMPLEX;
    }
}
