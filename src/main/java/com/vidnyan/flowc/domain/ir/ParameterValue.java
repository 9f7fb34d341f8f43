package com.vidnyan.flowc.domain.ir;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a typed parameter lookup.
 * Distinguishes a value the user set, a declared default, and a missing parameter.
 */
public final class ParameterValue<T> {

    public enum Status {
        PRESENT,
        DEFAULTED,
        MISSING
    }

    private final String name;
    private final T value;
    private final Status status;

    private ParameterValue(String name, T value, Status status) {
        this.name = name;
        this.value = value;
        this.status = status;
    }

    public static <T> ParameterValue<T> present(String name, T value) {
        return new ParameterValue<>(name, value, Status.PRESENT);
    }

    public static <T> ParameterValue<T> defaulted(String name, T value) {
        return new ParameterValue<>(name, value, Status.DEFAULTED);
    }

    public static <T> ParameterValue<T> missing(String name) {
        return new ParameterValue<>(name, null, Status.MISSING);
    }

    public String name() {
        return name;
    }

    public Status status() {
        return status;
    }

    /**
     * True for both user-set and defaulted values.
     */
    public boolean hasValue() {
        return status != Status.MISSING;
    }

    public boolean isDefaulted() {
        return status == Status.DEFAULTED;
    }

    public T get() {
        if (status == Status.MISSING) {
            throw new NoSuchElementException("Parameter '" + name + "' is missing");
        }
        return value;
    }

    public T orElse(T fallback) {
        return hasValue() ? value : fallback;
    }

    /**
     * Use {@code fallback} as the default when missing. A value that is already present or defaulted is kept.
     */
    public ParameterValue<T> withDefault(T fallback) {
        if (hasValue() || fallback == null) {
            return this;
        }
        return defaulted(name, fallback);
    }

    public <R> ParameterValue<R> map(Function<? super T, ? extends R> mapper) {
        if (!hasValue()) {
            return missing(name);
        }
        return new ParameterValue<>(name, mapper.apply(value), status);
    }

    public Optional<T> toOptional() {
        return hasValue() ? Optional.of(value) : Optional.empty();
    }

    @Override
    public String toString() {
        return name + "=" + (hasValue() ? value : "<missing>") + " (" + status + ")";
    }
}
