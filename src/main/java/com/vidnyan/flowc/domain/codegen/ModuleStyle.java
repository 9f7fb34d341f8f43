package com.vidnyan.flowc.domain.codegen;

import java.util.Locale;

/**
 * Module system of the generated script code.
 */
public enum ModuleStyle {
    ESM,
    CJS;

    public static ModuleStyle fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return ESM;
        }
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "esm", "module", "es" -> ESM;
            case "cjs", "commonjs" -> CJS;
            default -> throw new IllegalArgumentException("Unknown module style: " + tag);
        };
    }
}
