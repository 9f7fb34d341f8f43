package com.vidnyan.flowc.domain.ir;

import java.util.List;
import java.util.Map;

/**
 * A user-edited setting on a node.
 * {@code defaulted} is true when the value came from the declared default rather than the user.
 */
public record Parameter(
    String name,
    Object value,
    String declaredType,
    boolean defaulted
) {

    public static Parameter of(String name, Object value) {
        return new Parameter(name, value, inferType(value), false);
    }

    private static String inferType(Object value) {
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof List<?>) return "list";
        if (value instanceof Map<?, ?>) return "json";
        return "string";
    }
}
