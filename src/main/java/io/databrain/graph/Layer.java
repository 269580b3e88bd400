package io.databrain.graph;

/**
 * Knowledge tiers derived from a node's z-index.
 * 0-99 raw data, 100-199 information, 200-299 knowledge, 300+ wisdom.
 */
public enum Layer {
    RAW_DATA("Raw_Data"),
    INFORMATION("Information"),
    KNOWLEDGE("Knowledge"),
    WISDOM("Wisdom");

    private final String displayName;

    Layer(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static Layer fromZIndex(int zIndex) {
        if (zIndex < 100) return RAW_DATA;
        if (zIndex < 200) return INFORMATION;
        if (zIndex < 300) return KNOWLEDGE;
        return WISDOM;
    }

    /**
     * Knowledge and wisdom are the layers that feed training replays.
     */
    public boolean isConsolidated() {
        return this == KNOWLEDGE || this == WISDOM;
    }
}
