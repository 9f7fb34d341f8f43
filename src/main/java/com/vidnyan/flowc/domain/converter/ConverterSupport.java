package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentKind;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ImportSpec;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.ir.IrNode;
import com.vidnyan.flowc.domain.ir.ParameterValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared helpers for converters: literal formatting, fragment construction, naming.
 * Converters call these directly; there is no converter base class.
 */
public final class ConverterSupport {

    /** Identifier of the tracing callback handler declared by the cross-cutting fragments. */
    public static final String TRACING_HANDLER = "langfuseHandler";

    /** Identifier of the environment config object declared by the cross-cutting fragments. */
    public static final String CONFIG_OBJECT = "config";

    /** Rendered in place of a required input that has nothing wired into it. */
    public static final String MISSING_INPUT = "undefined";

    /** Prefixes of the functions a node may declare next to its variable. */
    public static final String RUN_PREFIX = "run";
    public static final String LOAD_PREFIX = "load";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ConverterSupport() {
    }

    /**
     * Fail with {@link UnsupportedTargetException} unless the target is in the script family.
     */
    public static void requireScriptTarget(IrNode node, ConversionContext context) {
        if (!context.target().isScript()) {
            throw new UnsupportedTargetException(node.type(), context.target());
        }
    }

    // ========== Fragments ==========

    public static CodeFragment importFragment(IrNode node, String module, String... symbols) {
        return CodeFragment.builder(node.id() + ":import:" + module, FragmentKind.IMPORT)
                .sourceNodeId(node.id())
                .importSpec(ImportSpec.of(module, symbols))
                .requiredPackage(packageOf(module))
                .build();
    }

    /**
     * Initialization fragment declaring the node's variable.
     */
    public static CodeFragment initialization(IrNode node, ConversionContext context,
                                              FragmentPriority priority, String expression) {
        String content = docComment(node, context.generation())
                + declaration(context.variableName(), expression, context.style());
        return CodeFragment.builder(node.id() + ":init", FragmentKind.INITIALIZATION)
                .sourceNodeId(node.id())
                .priority(priority)
                .content(content)
                .exportedName(context.variableName())
                .build();
    }

    /**
     * Execution fragment: an async run function invoking the node's runnable.
     */
    public static CodeFragment runFunction(IrNode node, ConversionContext context, String invocationTarget) {
        CodeStyle style = context.style();
        String functionName = RUN_PREFIX + pascalCase(context.variableName());
        String parameter = context.target() == TargetLanguage.TYPESCRIPT
                ? "input: Record<string, unknown>"
                : "input";
        String options = context.generation().tracing()
                ? ", { callbacks: [" + TRACING_HANDLER + "] }"
                : "";
        String content = "async function " + functionName + "(" + parameter + ") {\n"
                + style.indent() + "return " + invocationTarget + ".invoke(input" + options + ")"
                + style.terminator() + "\n"
                + "}";
        return CodeFragment.builder(node.id() + ":run", FragmentKind.EXECUTION)
                .sourceNodeId(node.id())
                .priority(FragmentPriority.EXECUTION)
                .content(content)
                .exportedName(functionName)
                .build();
    }

    // ========== Code text ==========

    public static String declaration(String name, String expression, CodeStyle style) {
        return "const " + name + " = " + expression + style.terminator();
    }

    /**
     * One-line doc comment when docs generation is enabled, otherwise empty.
     */
    public static String docComment(IrNode node, GenerationContext context) {
        if (!context.includeDocs()) {
            return "";
        }
        return "/** " + node.displayName().replace("*/", "* /") + " (" + node.type() + ") */\n";
    }

    public static String envReference(String key) {
        return "process.env." + key;
    }

    /**
     * Multi-line object literal from already rendered values.
     */
    public static String objectLiteral(Map<String, String> entries, CodeStyle style, int depth) {
        if (entries.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{\n");
        int remaining = entries.size();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            remaining--;
            sb.append(style.indent(depth + 1))
                    .append(propertyKey(entry.getKey(), style))
                    .append(": ")
                    .append(entry.getValue());
            if (remaining > 0 || style.trailingCommas()) {
                sb.append(',');
            }
            sb.append('\n');
        }
        return sb.append(style.indent(depth)).append('}').toString();
    }

    public static String arrayLiteral(List<String> renderedItems) {
        return "[" + String.join(", ", renderedItems) + "]";
    }

    public static String propertyKey(String key, CodeStyle style) {
        return IDENTIFIER.matcher(key).matches() ? key : style.quote(key);
    }

    /**
     * Render a parameter value as a literal of the target language.
     */
    public static String literal(Object value, CodeStyle style) {
        if (value == null) {
            return "undefined";
        }
        if (value instanceof String s) {
            return style.quote(s);
        }
        if (value instanceof Number n) {
            return formatNumber(n);
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof List<?> list) {
            return arrayLiteral(list.stream().map(v -> literal(v, style)).toList());
        }
        if (value instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return "{}";
            }
            return map.entrySet().stream()
                    .map(e -> propertyKey(String.valueOf(e.getKey()), style) + ": " + literal(e.getValue(), style))
                    .collect(Collectors.joining(", ", "{ ", " }"));
        }
        return style.quote(value.toString());
    }

    /**
     * Whole numbers render without a fractional part.
     */
    public static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "undefined";
            }
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    /**
     * Add a rendered parameter to an options map when it has a value.
     */
    public static void putIfPresent(Map<String, String> options, String key,
                                    ParameterValue<?> value, CodeStyle style) {
        if (value.hasValue()) {
            options.put(key, literal(value.get(), style));
        }
    }

    // ========== Naming ==========

    /**
     * npm package a module specifier belongs to; null for relative modules.
     */
    public static String packageOf(String module) {
        if (module.startsWith(".") || module.startsWith("/")) {
            return null;
        }
        String[] parts = module.split("/");
        if (module.startsWith("@") && parts.length >= 2) {
            return parts[0] + "/" + parts[1];
        }
        return parts[0];
    }

    public static String pascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '$' || c == '-') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }
}
