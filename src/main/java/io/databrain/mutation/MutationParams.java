package io.databrain.mutation;

import io.databrain.error.ValidationException;
import io.databrain.graph.Metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, validating view over raw action parameters. Every accessor throws
 * {@link ValidationException} on a malformed value, never anything else.
 */
public final class MutationParams {

    private final Map<String, Object> values;

    public MutationParams(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null) copy.put(k, v);
            });
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String requireString(String key) {
        return optionalString(key)
                .orElseThrow(() -> new ValidationException("Missing required parameter: " + key));
    }

    /** Present and non-blank; numbers and booleans are accepted in their string form. */
    public Optional<String> optionalString(String key) {
        Object value = values.get(key);
        if (value == null) return Optional.empty();
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            throw new ValidationException("Parameter '%s' must be a string".formatted(key));
        }
        String s = value.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    public double requireDouble(String key) {
        if (!has(key)) {
            throw new ValidationException("Missing required parameter: " + key);
        }
        return doubleValue(key, 0.0);
    }

    /**
     * Finite number (or numeric string) under {@code key}, or {@code defaultValue} when absent.
     */
    public double doubleValue(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Parameter '%s' is not a number: %s".formatted(key, s));
            }
        } else {
            throw new ValidationException("Parameter '%s' is not a number".formatted(key));
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ValidationException("Parameter '%s' must be finite".formatted(key));
        }
        return d;
    }

    public Optional<Integer> optionalInt(String key) {
        if (!has(key)) return Optional.empty();
        double d = doubleValue(key, 0.0);
        if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw new ValidationException("Parameter '%s' must be an integer".formatted(key));
        }
        return Optional.of((int) d);
    }

    public Metadata metadata(String key) {
        Object value = values.get(key);
        if (value == null) return Metadata.empty();
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k != null) converted.put(k.toString(), v);
            });
            return Metadata.of(converted);
        }
        throw new ValidationException("Parameter '%s' must be an object".formatted(key));
    }

    /** First non-blank string among {@code keys}, for log references. Never throws. */
    String firstReference(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value != null && !(value instanceof Map<?, ?>) && !(value instanceof Iterable<?>)
                    && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return null;
    }
}
