package com.seqflow.core.task;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered bag of scalar task parameters.
 *
 * <p>Values are restricted to strings, integers, longs, booleans and paths so
 * that two parameter sets built from the same configuration are always equal.
 */
public final class Parameters {

    private static final Parameters EMPTY = new Parameters(Map.of());

    private final Map<String, Object> values;

    private Parameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Parameters empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public String getString(String name) {
        return String.valueOf(require(name));
    }

    public int getInt(String name) {
        Object value = require(name);
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.parseInt(value.toString());
    }

    public long getLong(String name) {
        Object value = require(name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public boolean getBoolean(String name) {
        Object value = require(name);
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public Path getPath(String name) {
        Object value = require(name);
        return value instanceof Path p ? p : Path.of(value.toString());
    }

    /**
     * Renders a parameter as a single command-line argument.
     */
    public String render(String name) {
        return require(name).toString();
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Parameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, String value) {
            return putValue(name, value);
        }

        public Builder put(String name, int value) {
            return putValue(name, value);
        }

        public Builder put(String name, long value) {
            return putValue(name, value);
        }

        public Builder put(String name, boolean value) {
            return putValue(name, value);
        }

        public Builder put(String name, Path value) {
            return putValue(name, value);
        }

        private Builder putValue(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Parameter name must not be blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("Parameter '" + name + "' must not be null");
            }
            values.put(name, value);
            return this;
        }

        public Parameters build() {
            return values.isEmpty() ? EMPTY : new Parameters(values);
        }
    }
}
