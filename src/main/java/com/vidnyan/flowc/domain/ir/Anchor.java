package com.vidnyan.flowc.domain.ir;

import java.util.Arrays;
import java.util.List;

/**
 * A typed connection point on a node.
 * {@code dataType} may be a {@code |}-joined union and is only a compatibility hint.
 */
public record Anchor(
    String id,
    String name,
    String dataType,
    boolean required,
    boolean list
) {

    public static Anchor input(String id, String name, String dataType, boolean required, boolean list) {
        return new Anchor(id, name, dataType, required, list);
    }

    public static Anchor output(String id, String name, String dataType) {
        return new Anchor(id, name, dataType, false, false);
    }

    /**
     * Data type alternatives of a union type.
     */
    public List<String> dataTypes() {
        if (dataType == null || dataType.isBlank()) {
            return List.of();
        }
        return Arrays.stream(dataType.split("\\|"))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
