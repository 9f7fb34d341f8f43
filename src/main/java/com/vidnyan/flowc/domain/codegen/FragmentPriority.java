package com.vidnyan.flowc.domain.codegen;

/**
 * Coarse ordering buckets for body fragments. Lower values are emitted first.
 */
public enum FragmentPriority {
    IMPORT(0),
    CONFIG(100),
    MODEL(200),
    UTILITY(300),
    RETRIEVAL(400),
    CHAIN(500),
    AGENT(600),
    EXECUTION(900);

    private final int value;

    FragmentPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
