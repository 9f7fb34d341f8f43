package com.vidnyan.flowc.domain.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a conversion report.
 * Immutable value object; context keys keep their insertion order.
 */
public record Finding(
    FindingKind kind,
    Severity severity,
    String message,
    String nodeId,
    String edgeId,
    Map<String, Object> context
) {

    public Finding {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public boolean isStructural() {
        return kind.isStructural();
    }

    /**
     * Format for display.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(severity).append("] ").append(kind).append(": ").append(message);
        if (nodeId != null) {
            sb.append(" (node ").append(nodeId).append(')');
        }
        if (edgeId != null) {
            sb.append(" (edge ").append(edgeId).append(')');
        }
        return sb.toString();
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder(FindingKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final FindingKind kind;
        private Severity severity;
        private String message;
        private String nodeId;
        private String edgeId;
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder(FindingKind kind) {
            this.kind = kind;
            this.severity = kind.defaultSeverity();
        }

        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder nodeId(String id) { this.nodeId = id; return this; }
        public Builder edgeId(String id) { this.edgeId = id; return this; }
        public Builder context(Map<String, Object> ctx) { this.context.putAll(ctx); return this; }
        public Builder context(String key, Object value) { this.context.put(key, value); return this; }

        public Finding build() {
            return new Finding(kind, severity, message, nodeId, edgeId, context);
        }
    }
}
