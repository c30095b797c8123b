package com.phillippitts.voicedispatch.service.registry;

import java.util.Map;
import java.util.Optional;

/**
 * Typed, read-only view of the string arguments configured for a component.
 */
public final class ComponentArgs {

    private static final ComponentArgs EMPTY = new ComponentArgs(Map.of());

    private final Map<String, String> values;

    private ComponentArgs(Map<String, String> values) {
        this.values = values;
    }

    public static ComponentArgs of(Map<String, String> values) {
        return values == null || values.isEmpty() ? EMPTY : new ComponentArgs(Map.copyOf(values));
    }

    public static ComponentArgs empty() {
        return EMPTY;
    }

    public Optional<String> get(String key) {
        String v = values.get(key);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v.trim());
    }

    public String getString(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * @throws IllegalArgumentException if the argument is absent
     */
    public String require(String key) {
        return get(key).orElseThrow(() -> new IllegalArgumentException("Missing argument '" + key + "'"));
    }

    public double getDouble(String key, double defaultValue) {
        return get(key).map(v -> parseDouble(key, v)).orElse(defaultValue);
    }

    /**
     * @throws IllegalArgumentException if the argument is absent or not an integer
     */
    public long requireLong(String key) {
        String v = require(key);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + key + "' must be an integer, got: " + v, e);
        }
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + key + "' must be a number, got: " + v, e);
        }
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
