package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentKind;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ImportSpec;
import com.vidnyan.flowc.domain.converter.ConverterSupport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fragments that belong to no node: environment config and tracing setup.
 */
public final class CrossCuttingFragments {

    static final String TRACING_PACKAGE = "langfuse-langchain";
    static final String DEFAULT_LANGFUSE_URL = "https://cloud.langfuse.com";

    private CrossCuttingFragments() {
    }

    public static List<CodeFragment> create(GenerationContext context) {
        List<CodeFragment> fragments = new ArrayList<>();
        if (!context.environment().isEmpty()) {
            fragments.addAll(context.target().isScript()
                    ? scriptEnvironment(context)
                    : pythonEnvironment(context));
        }
        if (context.tracing() && context.target().isScript()) {
            fragments.addAll(tracing(context));
        }
        return fragments;
    }

    private static List<CodeFragment> scriptEnvironment(GenerationContext context) {
        CodeStyle style = context.style();
        Map<String, String> entries = new LinkedHashMap<>();
        context.environment().forEach((key, fallback) -> entries.put(key,
                fallback == null || fallback.isEmpty()
                        ? ConverterSupport.envReference(key)
                        : ConverterSupport.envReference(key) + " ?? " + style.quote(fallback)));

        CodeFragment dotenv = CodeFragment.builder("env:import", FragmentKind.IMPORT)
                .importSpec(ImportSpec.sideEffect("dotenv/config"))
                .requiredPackage("dotenv")
                .build();
        CodeFragment config = CodeFragment.builder("env:config", FragmentKind.DECLARATION)
                .priority(FragmentPriority.CONFIG)
                .content(ConverterSupport.declaration(ConverterSupport.CONFIG_OBJECT,
                        ConverterSupport.objectLiteral(entries, style, 0), style))
                .exportedName(ConverterSupport.CONFIG_OBJECT)
                .build();
        return List.of(dotenv, config);
    }

    private static List<CodeFragment> pythonEnvironment(GenerationContext context) {
        CodeStyle style = context.style();
        StringBuilder body = new StringBuilder(ConverterSupport.CONFIG_OBJECT).append(" = {\n");
        context.environment().forEach((key, fallback) -> body.append(style.indent())
                .append(style.quote(key)).append(": os.environ.get(").append(style.quote(key))
                .append(fallback == null || fallback.isEmpty() ? "" : ", " + style.quote(fallback))
                .append("),\n"));
        body.append('}');

        CodeFragment os = CodeFragment.builder("env:import", FragmentKind.IMPORT)
                .importSpec(ImportSpec.sideEffect("os"))
                .build();
        CodeFragment config = CodeFragment.builder("env:config", FragmentKind.DECLARATION)
                .priority(FragmentPriority.CONFIG)
                .content(body.toString())
                .exportedName(ConverterSupport.CONFIG_OBJECT)
                .build();
        return List.of(os, config);
    }

    private static List<CodeFragment> tracing(GenerationContext context) {
        CodeStyle style = context.style();
        Map<String, String> options = new LinkedHashMap<>();
        options.put("publicKey", ConverterSupport.envReference("LANGFUSE_PUBLIC_KEY"));
        options.put("secretKey", ConverterSupport.envReference("LANGFUSE_SECRET_KEY"));
        options.put("baseUrl", ConverterSupport.envReference("LANGFUSE_BASE_URL")
                + " ?? " + style.quote(DEFAULT_LANGFUSE_URL));

        CodeFragment handlerImport = CodeFragment.builder("tracing:import", FragmentKind.IMPORT)
                .importSpec(ImportSpec.of(TRACING_PACKAGE, "CallbackHandler"))
                .requiredPackage(TRACING_PACKAGE)
                .build();
        CodeFragment handler = CodeFragment.builder("tracing:init", FragmentKind.INITIALIZATION)
                .priority(FragmentPriority.CONFIG)
                .content(ConverterSupport.declaration(ConverterSupport.TRACING_HANDLER,
                        "new CallbackHandler(" + ConverterSupport.objectLiteral(options, style, 0) + ")",
                        style))
                .build();
        return List.of(handlerImport, handler);
    }
}
