package com.vidnyan.flowc.domain.converter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable names of upstream nodes, keyed by the input anchor name they are wired into.
 * Names under one anchor are in document order of their source nodes.
 */
public final class InputBindings {

    private static final InputBindings EMPTY = new InputBindings(Map.of());

    private final Map<String, List<String>> bindings;

    private InputBindings(Map<String, List<String>> bindings) {
        this.bindings = bindings;
    }

    public static InputBindings empty() {
        return EMPTY;
    }

    public static InputBindings of(Map<String, List<String>> bindings) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        bindings.forEach((anchor, names) -> copy.put(anchor, List.copyOf(names)));
        return new InputBindings(copy);
    }

    /**
     * The single variable wired into an anchor, or empty when nothing is connected.
     */
    public Optional<String> single(String anchorName) {
        List<String> names = bindings.getOrDefault(anchorName, List.of());
        return names.isEmpty() ? Optional.empty() : Optional.of(names.get(0));
    }

    /**
     * All variables wired into a list anchor.
     */
    public List<String> all(String anchorName) {
        return bindings.getOrDefault(anchorName, List.of());
    }

    public boolean has(String anchorName) {
        return !all(anchorName).isEmpty();
    }

    public Map<String, List<String>> asMap() {
        return Map.copyOf(bindings);
    }

    @Override
    public String toString() {
        return "InputBindings" + bindings;
    }
}
