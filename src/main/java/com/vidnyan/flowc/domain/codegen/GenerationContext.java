package com.vidnyan.flowc.domain.codegen;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable configuration threaded through lowering.
 * Built once per conversion run by the caller.
 */
public record GenerationContext(
    TargetLanguage target,
    ModuleStyle moduleStyle,
    boolean includeTests,
    boolean includeDocs,
    boolean tracing,
    Map<String, String> environment,
    CodeStyle style,
    String projectName
) {

    public GenerationContext {
        target = target != null ? target : TargetLanguage.TYPESCRIPT;
        moduleStyle = moduleStyle != null ? moduleStyle : ModuleStyle.ESM;
        // sorted so generated config objects are stable
        environment = environment != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(environment))
                : Collections.emptySortedMap();
        style = style != null ? style : CodeStyle.defaults();
        projectName = projectName != null && !projectName.isBlank() ? projectName : "flow";
    }

    public static GenerationContext defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TargetLanguage target = TargetLanguage.TYPESCRIPT;
        private ModuleStyle moduleStyle = ModuleStyle.ESM;
        private boolean includeTests;
        private boolean includeDocs;
        private boolean tracing;
        private Map<String, String> environment = Map.of();
        private CodeStyle style = CodeStyle.defaults();
        private String projectName = "flow";

        public Builder target(TargetLanguage target) { this.target = target; return this; }
        public Builder moduleStyle(ModuleStyle style) { this.moduleStyle = style; return this; }
        public Builder includeTests(boolean include) { this.includeTests = include; return this; }
        public Builder includeDocs(boolean include) { this.includeDocs = include; return this; }
        public Builder tracing(boolean tracing) { this.tracing = tracing; return this; }
        public Builder environment(Map<String, String> env) { this.environment = env; return this; }
        public Builder style(CodeStyle style) { this.style = style; return this; }
        public Builder projectName(String name) { this.projectName = name; return this; }

        public GenerationContext build() {
            return new GenerationContext(target, moduleStyle, includeTests, includeDocs,
                    tracing, environment, style, projectName);
        }
    }
}
