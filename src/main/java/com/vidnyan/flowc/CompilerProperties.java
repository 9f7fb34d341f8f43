package com.vidnyan.flowc;

import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the compiler.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "flowc")
public class CompilerProperties {

    private Convert convert = new Convert();
    private Generation generation = new Generation();
    private Registry registry = new Registry();
    private Lowering lowering = new Lowering();

    /**
     * One-shot conversion run by the CLI runner.
     */
    @Data
    public static class Convert {
        /**
         * Flow file to convert. Empty = no CLI conversion.
         */
        private String input = "";
        private String output = "generated";
        private boolean overwrite = false;
    }

    /**
     * Defaults for the generation context.
     */
    @Data
    public static class Generation {
        private String target = "typescript";
        private String moduleStyle = "esm";
        private boolean includeTests = false;
        private boolean includeDocs = false;
        private boolean tracing = false;
        private int indentSize = 2;
        private String quoteStyle = "single";
        private boolean semicolons = true;
        private boolean trailingCommas = true;
        private String projectName = "flow";
        private Map<String, String> environment = new LinkedHashMap<>();

        public GenerationContext.Builder toBuilder() {
            return GenerationContext.builder()
                    .target(TargetLanguage.fromTag(target))
                    .moduleStyle(ModuleStyle.fromTag(moduleStyle))
                    .includeTests(includeTests)
                    .includeDocs(includeDocs)
                    .tracing(tracing)
                    .environment(environment)
                    .style(new CodeStyle(indentSize, CodeStyle.QuoteStyle.fromTag(quoteStyle),
                            semicolons, trailingCommas))
                    .projectName(projectName);
        }

        public GenerationContext toContext() {
            return toBuilder().build();
        }
    }

    @Data
    public static class Registry {
        /**
         * Alias -> registered node type.
         */
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    @Data
    public static class Lowering {
        /**
         * 1 = sequential; more lowers nodes on a worker pool.
         */
        private int parallelism = 1;
    }
}
