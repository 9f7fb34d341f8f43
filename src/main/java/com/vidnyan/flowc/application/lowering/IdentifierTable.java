package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.ir.FlowGraph;
import com.vidnyan.flowc.domain.ir.IrNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variable name of every node in the generated code.
 * Assigned in document order so collisions resolve the same way on every run.
 */
public final class IdentifierTable {

    private static final Set<String> RESERVED = Set.of(
            // JavaScript / TypeScript
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
            "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this",
            "throw", "true", "try", "typeof", "var", "void", "while", "with", "yield", "let",
            "static", "await", "async", "interface", "package", "private", "protected", "public",
            "implements", "undefined", "process", "require", "module", "exports",
            // Python
            "and", "as", "assert", "def", "del", "elif", "except", "from", "global", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "None", "True", "False",
            // names declared by cross-cutting fragments and run functions
            ConverterSupport.CONFIG_OBJECT, ConverterSupport.TRACING_HANDLER, "input"
    );

    private final Map<String, String> byNodeId;

    private IdentifierTable(Map<String, String> byNodeId) {
        this.byNodeId = Collections.unmodifiableMap(byNodeId);
    }

    public static IdentifierTable assign(FlowGraph graph) {
        return assign(graph, Set.of());
    }

    /**
     * Names that never equal one of {@code importedSymbols}. A node whose sanitized id is an
     * imported symbol gets a {@code Node} suffix.
     */
    public static IdentifierTable assign(FlowGraph graph, Set<String> importedSymbols) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>(importedSymbols);
        for (IrNode node : graph.nodeList()) {
            String base = sanitize(node.id());
            if (importedSymbols.contains(base)) {
                base = base + "Node";
            }
            String candidate = base;
            int suffix = 2;
            while (!claim(used, candidate)) {
                candidate = base + "_" + suffix++;
            }
            names.put(node.id(), candidate);
        }
        return new IdentifierTable(names);
    }

    /**
     * Every name the table puts into the generated module: the variables and the run / load
     * functions derived from them.
     */
    public Set<String> declaredNames() {
        Set<String> declared = new LinkedHashSet<>();
        byNodeId.values().forEach(name -> declared.addAll(derivedNames(name)));
        return declared;
    }

    public boolean clashesWith(Set<String> symbols) {
        return !Collections.disjoint(declaredNames(), symbols);
    }

    private static boolean claim(Set<String> used, String name) {
        List<String> derived = derivedNames(name);
        if (derived.stream().anyMatch(used::contains)) {
            return false;
        }
        used.addAll(derived);
        return true;
    }

    static List<String> derivedNames(String name) {
        String pascal = ConverterSupport.pascalCase(name);
        return List.of(name, ConverterSupport.RUN_PREFIX + pascal, ConverterSupport.LOAD_PREFIX + pascal);
    }

    /**
     * Identifier for a node; nodes unknown to the table get a sanitized form of their id.
     */
    public String identifierFor(String nodeId) {
        String assigned = byNodeId.get(nodeId);
        return assigned != null ? assigned : sanitize(nodeId);
    }

    public Map<String, String> asMap() {
        return byNodeId;
    }

    static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "node";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : raw.trim().toCharArray()) {
            boolean valid = Character.isLetterOrDigit(c) && c < 128 || c == '_' || c == '$';
            if (valid) {
                sb.append(c);
            } else if (sb.length() == 0 || sb.charAt(sb.length() - 1) != '_') {
                sb.append('_');
            }
        }
        String name = sb.toString();
        if (name.isEmpty() || name.equals("_")) {
            return "node";
        }
        if (Character.isDigit(name.charAt(0))) {
            name = "node_" + name;
        }
        if (RESERVED.contains(name)) {
            name = name + "Node";
        }
        return name;
    }
}
