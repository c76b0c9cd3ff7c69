package com.vidnyan.slate.domain.rule;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only, rule-scoped configuration parameters.
 */
public record RuleParameters(Map<String, Object> values) {

    private static final RuleParameters EMPTY = new RuleParameters(Map.of());

    public RuleParameters {
        if (values == null) {
            values = Map.of();
        } else {
            Map<String, Object> present = new HashMap<>(values);
            present.values().removeIf(Objects::isNull);
            values = Map.copyOf(present);
        }
    }

    public static RuleParameters empty() {
        return EMPTY;
    }

    /**
     * Get a raw parameter value.
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Get an integer parameter. Accepts an integral JSON number within int range or a numeric string.
     *
     * @throws InvalidConfigurationException when the value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw new InvalidConfigurationException(
                        "Parameter '" + key + "' must be an integer but was " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    "Parameter '" + key + "' must be an integer but was '" + value + "'", e);
        }
    }

    /**
     * Get a boolean parameter.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Get a string parameter.
     */
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }
}
