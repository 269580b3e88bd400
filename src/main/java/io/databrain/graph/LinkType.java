package io.databrain.graph;

import io.databrain.error.ValidationException;

import java.util.Locale;

public enum LinkType {
    SEMANTIC,
    CAUSAL,
    TEMPORAL,
    HIERARCHICAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LinkType fromString(String s) {
        if (s == null || s.isBlank()) return SEMANTIC;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown link type: " + s);
        }
    }
}
