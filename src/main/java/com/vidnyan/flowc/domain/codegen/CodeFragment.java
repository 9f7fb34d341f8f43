package com.vidnyan.flowc.domain.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * One unit of generated output.
 * Produced once by a converter, placed by the lowering engine, never mutated afterwards.
 */
public record CodeFragment(
    String id,
    FragmentKind kind,
    String content,
    List<String> requiredPackages,
    String sourceNodeId,        // null for cross-cutting fragments
    int priority,
    List<String> exportedNames,
    List<ImportSpec> importSpecs,
    int emissionIndex,          // -1 until placed; cross-cutting fragments stay at -1
    int sequence
) {

    public CodeFragment {
        content = content != null ? content : "";
        requiredPackages = requiredPackages != null ? List.copyOf(requiredPackages) : List.of();
        exportedNames = exportedNames != null ? List.copyOf(exportedNames) : List.of();
        importSpecs = importSpecs != null ? List.copyOf(importSpecs) : List.of();
    }

    public boolean isImport() {
        return kind == FragmentKind.IMPORT;
    }

    public boolean isCrossCutting() {
        return sourceNodeId == null;
    }

    /**
     * Copy carrying the position assigned by the lowering engine.
     */
    public CodeFragment placed(int emissionIndex, int sequence, int priority) {
        return new CodeFragment(id, kind, content, requiredPackages, sourceNodeId,
                priority, exportedNames, importSpecs, emissionIndex, sequence);
    }

    public static Builder builder(String id, FragmentKind kind) {
        return new Builder(id, kind);
    }

    public static class Builder {
        private final String id;
        private final FragmentKind kind;
        private String content = "";
        private final List<String> requiredPackages = new ArrayList<>();
        private String sourceNodeId;
        private int priority;
        private final List<String> exportedNames = new ArrayList<>();
        private final List<ImportSpec> importSpecs = new ArrayList<>();

        private Builder(String id, FragmentKind kind) {
            this.id = id;
            this.kind = kind;
            this.priority = kind == FragmentKind.IMPORT
                    ? FragmentPriority.IMPORT.value()
                    : FragmentPriority.UTILITY.value();
        }

        public Builder content(String content) { this.content = content; return this; }
        public Builder sourceNodeId(String nodeId) { this.sourceNodeId = nodeId; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder priority(FragmentPriority priority) { this.priority = priority.value(); return this; }

        public Builder requiredPackage(String pkg) {
            if (pkg != null && !requiredPackages.contains(pkg)) {
                requiredPackages.add(pkg);
            }
            return this;
        }

        public Builder exportedName(String name) {
            exportedNames.add(name);
            return this;
        }

        public Builder importSpec(ImportSpec spec) {
            importSpecs.add(spec);
            return this;
        }

        public CodeFragment build() {
            return new CodeFragment(id, kind, content, requiredPackages, sourceNodeId,
                    priority, exportedNames, importSpecs, -1, 0);
        }
    }
}
