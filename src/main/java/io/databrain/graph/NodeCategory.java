package io.databrain.graph;

import io.databrain.error.ValidationException;

import java.util.Locale;

/**
 * Whether a node is long-lived knowledge or a short-lived observation.
 */
public enum NodeCategory {
    STATIC,
    EPHEMERAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeCategory fromString(String s) {
        if (s == null || s.isBlank()) return STATIC;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "static" -> STATIC;
            case "ephemeral" -> EPHEMERAL;
            default -> throw new ValidationException("Unknown node category: " + s);
        };
    }
}
