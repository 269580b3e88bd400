package io.databrain.graph;

import io.databrain.error.ValidationException;

import java.util.Locale;

/**
 * Node types. Each carries the canonical z-index used when a node is created
 * without an explicit override.
 */
public enum NodeType {
    CONCEPT(150),
    ENTITY(150),
    PROCESS(150),
    RESOURCE(150),
    RAW_DATA(50),
    INFORMATION(150),
    KNOWLEDGE(250),
    WISDOM(350);

    private final int canonicalZIndex;

    NodeType(int canonicalZIndex) {
        this.canonicalZIndex = canonicalZIndex;
    }

    public int canonicalZIndex() {
        return canonicalZIndex;
    }

    /** Wire name, e.g. {@code raw_data}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name. Null or blank means {@link #INFORMATION}.
     *
     * @throws ValidationException for unknown names
     */
    public static NodeType fromString(String s) {
        if (s == null || s.isBlank()) return INFORMATION;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown node type: " + s);
        }
    }
}
