package com.vidnyan.flowc.domain.ir;

import java.util.List;
import java.util.Optional;

/**
 * One visual block of a flow.
 * Immutable within a conversion run; validity judgments live in the analyzer.
 */
public record IrNode(
    String id,
    String type,
    String category,
    String label,
    String version,
    List<Parameter> parameters,
    List<Anchor> inputs,
    List<Anchor> outputs
) {

    public IrNode {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    /**
     * Get input anchor by id.
     */
    public Optional<Anchor> findInput(String anchorId) {
        return inputs.stream().filter(a -> a.id().equals(anchorId)).findFirst();
    }

    /**
     * Get output anchor by id.
     */
    public Optional<Anchor> findOutput(String anchorId) {
        return outputs.stream().filter(a -> a.id().equals(anchorId)).findFirst();
    }

    /**
     * Get input anchor by its declared name.
     */
    public Optional<Anchor> findInputByName(String name) {
        return inputs.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public Optional<Parameter> findParameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Typed parameter lookup. Null and blank values count as missing.
     *
     * @throws IllegalArgumentException when the stored value cannot be read as {@code type}
     */
    public <T> ParameterValue<T> parameter(String name, Class<T> type) {
        Optional<Parameter> param = findParameter(name);
        if (param.isEmpty() || isEmpty(param.get().value())) {
            return ParameterValue.missing(name);
        }
        T value = coerce(name, param.get().value(), type);
        return param.get().defaulted()
                ? ParameterValue.defaulted(name, value)
                : ParameterValue.present(name, value);
    }

    public <T> ParameterValue<T> parameter(String name, Class<T> type, T defaultValue) {
        return parameter(name, type).withDefault(defaultValue);
    }

    public ParameterValue<String> stringParam(String name) {
        return parameter(name, String.class);
    }

    public ParameterValue<Double> numberParam(String name) {
        return parameter(name, Double.class);
    }

    public ParameterValue<Integer> intParam(String name) {
        return parameter(name, Integer.class);
    }

    public ParameterValue<Boolean> boolParam(String name) {
        return parameter(name, Boolean.class);
    }

    /**
     * Label if set, otherwise the type identifier.
     */
    public String displayName() {
        return label != null && !label.isBlank() ? label : type;
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    @SuppressWarnings("unchecked")
    private <T> T coerce(String name, Object raw, Class<T> type) {
        if (type.isInstance(raw)) {
            return (T) raw;
        }
        try {
            if (type == String.class) {
                return (T) String.valueOf(raw);
            }
            if (type == Double.class) {
                return (T) (raw instanceof Number n ? Double.valueOf(n.doubleValue()) : Double.valueOf(raw.toString().trim()));
            }
            if (type == Integer.class) {
                return (T) (raw instanceof Number n ? Integer.valueOf(n.intValue()) : Integer.valueOf(raw.toString().trim()));
            }
            if (type == Boolean.class && raw instanceof String s) {
                if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
                    return (T) Boolean.valueOf(s);
                }
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Parameter '" + name + "' on node " + id + " is not a valid " + type.getSimpleName() + ": " + raw, e);
        }
        throw new IllegalArgumentException(
                "Parameter '" + name + "' on node " + id + " is not a valid " + type.getSimpleName() + ": " + raw);
    }
}
