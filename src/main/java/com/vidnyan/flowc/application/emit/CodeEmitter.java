package com.vidnyan.flowc.application.emit;

import com.vidnyan.flowc.application.lowering.LoweringResult;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic merge of placed fragments into source text.
 * Reorders and merges fragments, never rewrites their content.
 */
public class CodeEmitter {

    static final Comparator<CodeFragment> BODY_ORDER = Comparator
            .comparingInt(CodeFragment::priority)
            .thenComparingInt(CodeFragment::emissionIndex)
            .thenComparingInt(CodeFragment::sequence);

    private final ImportRenderer importRenderer;

    public CodeEmitter() {
        this(new ImportRenderer());
    }

    public CodeEmitter(ImportRenderer importRenderer) {
        this.importRenderer = importRenderer;
    }

    public EmittedProgram emit(LoweringResult lowering, GenerationContext context) {
        return emit(lowering.fragments(), lowering.dependencies(), context);
    }

    public EmittedProgram emit(List<CodeFragment> fragments, GenerationContext context) {
        return emit(fragments, List.of(), context);
    }

    private EmittedProgram emit(List<CodeFragment> fragments, Collection<String> extraDependencies,
                                GenerationContext context) {
        List<String> imports = importRenderer.render(fragments, context);

        List<CodeFragment> body = fragments.stream()
                .filter(f -> !f.isImport())
                .sorted(BODY_ORDER)
                .toList();

        Set<String> exports = new LinkedHashSet<>();
        body.forEach(f -> exports.addAll(f.exportedNames()));

        List<String> sections = new ArrayList<>();
        if (context.includeDocs()) {
            sections.add(header(fragments, context));
        }
        if (!imports.isEmpty()) {
            sections.add(String.join("\n", imports));
        }
        body.stream()
                .map(CodeFragment::content)
                .filter(content -> !content.isBlank())
                .forEach(sections::add);
        if (!exports.isEmpty()) {
            sections.add(exportStatement(exports, context));
        }
        String source = sections.isEmpty() ? "" : String.join("\n\n", sections) + "\n";

        Set<String> dependencies = new TreeSet<>(extraDependencies);
        fragments.forEach(f -> dependencies.addAll(f.requiredPackages()));

        String testSource = null;
        List<String> devDependencies = List.of();
        if (context.includeTests()) {
            testSource = testSource(exports, context);
            devDependencies = devDependencies(context);
        }

        return new EmittedProgram(context.target(), source, testSource,
                List.copyOf(dependencies), devDependencies, List.copyOf(exports));
    }

    private String header(List<CodeFragment> fragments, GenerationContext context) {
        long nodes = fragments.stream()
                .map(CodeFragment::sourceNodeId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        String summary = "Generated by flowc from " + nodes + (nodes == 1 ? " node." : " nodes.");
        if (!context.target().isScript()) {
            return "\"\"\"\n" + context.projectName() + "\n\n" + summary + "\n\"\"\"";
        }
        return "/**\n * " + context.projectName() + "\n *\n * " + summary + "\n */";
    }

    private String exportStatement(Set<String> exports, GenerationContext context) {
        CodeStyle style = context.style();
        String names = String.join(", ", exports);
        if (!context.target().isScript()) {
            return "__all__ = [" + String.join(", ", exports.stream().map(style::quote).toList()) + "]";
        }
        if (context.moduleStyle() == ModuleStyle.CJS) {
            return "module.exports = { " + names + " }" + style.terminator();
        }
        return "export { " + names + " }" + style.terminator();
    }

    /**
     * Smoke test importing every exported name and asserting it is defined.
     */
    private String testSource(Set<String> exports, GenerationContext context) {
        CodeStyle style = context.style();
        String names = String.join(", ", exports);
        if (!context.target().isScript()) {
            StringBuilder sb = new StringBuilder();
            if (!exports.isEmpty()) {
                sb.append("from index import ").append(names).append("\n\n\n");
            }
            sb.append("def test_exports_defined():\n");
            if (exports.isEmpty()) {
                sb.append(style.indent()).append("pass\n");
            }
            exports.forEach(name -> sb.append(style.indent())
                    .append("assert ").append(name).append(" is not None\n"));
            return sb.toString();
        }

        String end = style.terminator();
        StringBuilder sb = new StringBuilder();
        if (!exports.isEmpty()) {
            String module = style.quote("./index");
            sb.append(context.moduleStyle() == ModuleStyle.CJS
                    ? "const { " + names + " } = require(" + module + ")" + end
                    : "import { " + names + " } from " + module + end).append("\n\n");
        }
        sb.append("describe(").append(style.quote(context.projectName())).append(", () => {\n");
        sb.append(style.indent()).append("test(").append(style.quote("exports are defined"))
                .append(", () => {\n");
        exports.forEach(name -> sb.append(style.indent(2))
                .append("expect(").append(name).append(").toBeDefined()").append(end).append('\n'));
        sb.append(style.indent()).append("})").append(end).append('\n');
        sb.append("})").append(end).append('\n');
        return sb.toString();
    }

    private List<String> devDependencies(GenerationContext context) {
        if (context.target() == TargetLanguage.PYTHON) {
            return List.of("pytest");
        }
        if (context.target() == TargetLanguage.TYPESCRIPT) {
            return List.of("@types/jest", "jest", "ts-jest");
        }
        return List.of("jest");
    }
}
