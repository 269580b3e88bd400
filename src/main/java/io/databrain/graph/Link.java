package io.databrain.graph;

import java.time.Instant;

/**
 * A directed, weighted relationship between two distinct nodes.
 *
 * @param id             unique identifier
 * @param sourceId       origin node
 * @param targetId       destination node, never equal to {@code sourceId}
 * @param strength       relationship strength in [0, 1]
 * @param linkType       kind of relationship
 * @param createdAt      creation time
 * @param lastTraversed  last time a context read followed this link, or null
 * @param traversalCount number of traversals
 * @param weight         caller-supplied weight
 * @param metadata       open key/value map
 */
public record Link(
        String id,
        String sourceId,
        String targetId,
        double strength,
        LinkType linkType,
        Instant createdAt,
        Instant lastTraversed,
        long traversalCount,
        double weight,
        Metadata metadata
) {
    public static final double MIN_STRENGTH = 0.0;
    public static final double MAX_STRENGTH = 1.0;

    public Link {
        if (metadata == null) metadata = Metadata.empty();
        if (linkType == null) linkType = LinkType.SEMANTIC;
    }

    public static double clampStrength(double strength) {
        if (Double.isNaN(strength)) return MIN_STRENGTH;
        return Math.min(MAX_STRENGTH, Math.max(MIN_STRENGTH, strength));
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    public Link withEndpoints(String newSource, String newTarget) {
        return new Link(id, newSource, newTarget, strength, linkType, createdAt, lastTraversed,
                traversalCount, weight, metadata);
    }

    public Link withStrength(double newStrength) {
        double clamped = clampStrength(newStrength);
        return new Link(id, sourceId, targetId, clamped, linkType, createdAt, lastTraversed,
                traversalCount, clamped, metadata);
    }
}
