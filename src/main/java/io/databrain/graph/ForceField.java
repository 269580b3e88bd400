package io.databrain.graph;

import java.time.Instant;

/**
 * Named cluster attractor used for layout only.
 */
public record ForceField(
        String id,
        String label,
        double x,
        double y,
        int radius,
        double strength,
        String signature,
        Instant createdAt
) {
    public static final int DEFAULT_RADIUS = 150;
    public static final double DEFAULT_STRENGTH = 0.5;
}
