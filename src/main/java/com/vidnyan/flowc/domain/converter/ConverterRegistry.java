package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.ir.IrNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flat dispatch table from node-type identifier to converter, plus an alias table.
 * Immutable once built; safe for concurrent reads from parallel conversion runs.
 */
public final class ConverterRegistry {

    private final Map<String, NodeConverter> byType;
    private final Map<String, String> aliases;

    private ConverterRegistry(Map<String, NodeConverter> byType, Map<String, String> aliases) {
        this.byType = Collections.unmodifiableMap(byType);
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static ConverterRegistry empty() {
        return builder().build();
    }

    /**
     * Look up a converter: exact type identifier first, then the alias table.
     */
    public Optional<NodeConverter> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        NodeConverter exact = byType.get(type);
        if (exact != null) {
            return Optional.of(exact);
        }
        String target = aliases.get(type);
        return target != null ? Optional.ofNullable(byType.get(target)) : Optional.empty();
    }

    public boolean hasConverter(String type) {
        return find(type).isPresent();
    }

    /**
     * Registered type an identifier resolves to, following aliases.
     */
    public Optional<String> resolveType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        if (byType.containsKey(type)) {
            return Optional.of(type);
        }
        return Optional.ofNullable(aliases.get(type));
    }

    public boolean isAlias(String type) {
        return aliases.containsKey(type);
    }

    /**
     * Whether a converter found for this node actually accepts it.
     * A node reached through an alias is accepted by configuration.
     */
    public boolean accepts(NodeConverter converter, IrNode node) {
        return isAlias(node.type()) || converter.canConvert(node);
    }

    public Set<String> registeredTypes() {
        return byType.keySet();
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * Distinct converters, ordered by their primary type.
     */
    public List<NodeConverter> converters() {
        Map<NodeConverter, Boolean> seen = new IdentityHashMap<>();
        List<NodeConverter> result = new ArrayList<>();
        for (NodeConverter converter : byType.values()) {
            if (seen.put(converter, Boolean.TRUE) == null) {
                result.add(converter);
            }
        }
        result.sort((a, b) -> a.type().compareTo(b.type()));
        return result;
    }

    public Stats stats() {
        List<NodeConverter> distinct = converters();
        Map<String, Integer> byCategory = new TreeMap<>();
        int deprecated = 0;
        for (NodeConverter converter : distinct) {
            byCategory.merge(converter.category(), 1, Integer::sum);
            if (converter.isDeprecated()) {
                deprecated++;
            }
        }
        return new Stats(byType.size(), distinct.size(), aliases.size(), deprecated, byCategory);
    }

    public record Stats(
        int typeCount,
        int converterCount,
        int aliasCount,
        int deprecatedCount,
        Map<String, Integer> byCategory
    ) {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects registrations; all consistency checks run in {@link #build()},
     * so registration order never matters.
     */
    public static class Builder {
        private final List<NodeConverter> converters = new ArrayList<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        public Builder register(NodeConverter converter) {
            converters.add(converter);
            return this;
        }

        public Builder registerAll(Collection<? extends NodeConverter> all) {
            converters.addAll(all);
            return this;
        }

        public Builder alias(String alias, String type) {
            String previous = aliases.putIfAbsent(alias, type);
            if (previous != null && !previous.equals(type)) {
                throw new RegistryConfigurationException(
                        "Alias '" + alias + "' maps to both '" + previous + "' and '" + type + "'");
            }
            return this;
        }

        public Builder aliases(Map<String, String> all) {
            all.forEach(this::alias);
            return this;
        }

        public ConverterRegistry build() {
            Map<String, NodeConverter> byType = new TreeMap<>();
            for (NodeConverter converter : converters) {
                for (String type : converter.handledTypes()) {
                    if (type == null || type.isBlank()) {
                        throw new RegistryConfigurationException(
                                converter.getName() + " declares a blank node type");
                    }
                    NodeConverter existing = byType.putIfAbsent(type, converter);
                    if (existing != null && existing != converter) {
                        throw new RegistryConfigurationException(
                                "Node type '" + type + "' is claimed by both "
                                        + existing.getName() + " and " + converter.getName());
                    }
                }
            }

            Map<String, String> aliasTable = new TreeMap<>();
            for (Map.Entry<String, String> alias : aliases.entrySet()) {
                if (byType.containsKey(alias.getKey())) {
                    throw new RegistryConfigurationException(
                            "Alias '" + alias.getKey() + "' shadows a registered node type");
                }
                if (!byType.containsKey(alias.getValue())) {
                    throw new RegistryConfigurationException(
                            "Alias '" + alias.getKey() + "' points at unregistered type '"
                                    + alias.getValue() + "'");
                }
                aliasTable.put(alias.getKey(), alias.getValue());
            }
            return new ConverterRegistry(byType, aliasTable);
        }
    }
}
