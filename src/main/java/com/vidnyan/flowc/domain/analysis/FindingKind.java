package com.vidnyan.flowc.domain.analysis;

/**
 * What a finding is about. Each kind carries its default severity and error class.
 */
public enum FindingKind {
    DUPLICATE_NODE_ID(ErrorClass.STRUCTURAL, Severity.BLOCKER),
    DANGLING_EDGE(ErrorClass.STRUCTURAL, Severity.BLOCKER),
    UNKNOWN_ANCHOR(ErrorClass.STRUCTURAL, Severity.BLOCKER),
    ANCHOR_DIRECTION(ErrorClass.STRUCTURAL, Severity.BLOCKER),
    ARITY_VIOLATION(ErrorClass.STRUCTURAL, Severity.BLOCKER),
    MISSING_REQUIRED_INPUT(ErrorClass.COMPLETENESS, Severity.ERROR),
    UNSUPPORTED_NODE_TYPE(ErrorClass.COVERAGE, Severity.WARN),
    CYCLE(ErrorClass.CYCLICAL, Severity.WARN),
    CYCLE_FALLBACK(ErrorClass.CYCLICAL, Severity.WARN),
    LOWERING_FAILURE(ErrorClass.LOWERING, Severity.ERROR),
    UNSUPPORTED_VERSION(ErrorClass.DEPRECATION, Severity.WARN),
    DEPRECATED_NODE_TYPE(ErrorClass.DEPRECATION, Severity.INFO),
    ISOLATED_NODE(ErrorClass.INFORMATIONAL, Severity.INFO);

    public enum ErrorClass {
        STRUCTURAL,
        COMPLETENESS,
        COVERAGE,
        CYCLICAL,
        LOWERING,
        DEPRECATION,
        INFORMATIONAL
    }

    private final ErrorClass errorClass;
    private final Severity defaultSeverity;

    FindingKind(ErrorClass errorClass, Severity defaultSeverity) {
        this.errorClass = errorClass;
        this.defaultSeverity = defaultSeverity;
    }

    public ErrorClass errorClass() {
        return errorClass;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public boolean isStructural() {
        return errorClass == ErrorClass.STRUCTURAL;
    }
}
