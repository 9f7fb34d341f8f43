package com.vidnyan.flowc.application.emit;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ImportSpec;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges import specs by (module, symbol) and renders the import block.
 */
public class ImportRenderer {

    /** Package modules lexicographically, relative modules after them. */
    static final Comparator<String> MODULE_ORDER = Comparator
            .comparing((String m) -> m.startsWith(".") || m.startsWith("/"))
            .thenComparing(Comparator.naturalOrder());

    /**
     * Module to symbol set over the import fragments; an empty set is a side-effect import.
     */
    public Map<String, Set<String>> merge(List<CodeFragment> fragments) {
        Map<String, Set<String>> merged = new TreeMap<>(MODULE_ORDER);
        for (CodeFragment fragment : fragments) {
            if (!fragment.isImport()) {
                continue;
            }
            for (ImportSpec spec : fragment.importSpecs()) {
                merged.computeIfAbsent(spec.module(), m -> new TreeSet<>()).addAll(spec.symbols());
            }
        }
        return merged;
    }

    public List<String> render(Map<String, Set<String>> merged, GenerationContext context) {
        List<String> lines = new ArrayList<>(merged.size());
        merged.forEach((module, symbols) -> lines.add(renderOne(module, symbols, context)));
        return lines;
    }

    public List<String> render(List<CodeFragment> fragments, GenerationContext context) {
        return render(merge(fragments), context);
    }

    private String renderOne(String module, Set<String> symbols, GenerationContext context) {
        CodeStyle style = context.style();
        String names = String.join(", ", symbols);

        if (!context.target().isScript()) {
            return symbols.isEmpty()
                    ? "import " + module
                    : "from " + module + " import " + names;
        }

        String quoted = style.quote(module);
        if (context.moduleStyle() == ModuleStyle.CJS) {
            return symbols.isEmpty()
                    ? "require(" + quoted + ")" + style.terminator()
                    : "const { " + names + " } = require(" + quoted + ")" + style.terminator();
        }
        return symbols.isEmpty()
                ? "import " + quoted + style.terminator()
                : "import { " + names + " } from " + quoted + style.terminator();
    }
}
