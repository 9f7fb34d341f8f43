package com.vidnyan.flowc.domain.codegen;

import java.util.Arrays;
import java.util.List;

/**
 * Structured import request: a module and the symbols taken from it.
 * An empty symbol list means a side-effect import.
 */
public record ImportSpec(String module, List<String> symbols) {

    public ImportSpec {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("Import module must not be blank");
        }
        symbols = symbols != null ? List.copyOf(symbols) : List.of();
    }

    public static ImportSpec of(String module, String... symbols) {
        return new ImportSpec(module, Arrays.asList(symbols));
    }

    public static ImportSpec sideEffect(String module) {
        return new ImportSpec(module, List.of());
    }

    public boolean isSideEffect() {
        return symbols.isEmpty();
    }

    /**
     * Local modules ("./x", "../x", "/abs") sort after packages.
     */
    public boolean isRelative() {
        return module.startsWith(".") || module.startsWith("/");
    }
}
