package io.databrain.graph;

import java.time.Instant;

/**
 * A unit of knowledge in the brain.
 *
 * @param id                  immutable, globally unique identifier
 * @param label               short human-readable name
 * @param type                node type
 * @param x                   advisory layout coordinate
 * @param y                   advisory layout coordinate
 * @param zIndex              layer position, see {@link Layer#fromZIndex(int)}
 * @param mass                importance, always within [{@link #MIN_MASS}, {@link #MAX_MASS}]
 * @param category            static or ephemeral
 * @param similaritySignature opaque scorer-specific signature
 * @param createdAt           creation time
 * @param lastAccessed        last read or reinforcement
 * @param accessCount         number of accesses
 * @param clusterId           layout cluster
 * @param description         free text
 * @param metadata            open key/value map
 * @param redirectedTo        surviving node id once merged away, otherwise null
 * @param lastDecayAppliedAt  when scheduled decay last touched this node, or null
 * @param version             optimistic-concurrency fingerprint, bumped on every write
 */
public record Node(
        String id,
        String label,
        NodeType type,
        double x,
        double y,
        int zIndex,
        double mass,
        NodeCategory category,
        String similaritySignature,
        Instant createdAt,
        Instant lastAccessed,
        long accessCount,
        int clusterId,
        String description,
        Metadata metadata,
        String redirectedTo,
        Instant lastDecayAppliedAt,
        long version
) {
    public static final double MIN_MASS = 1.0;
    public static final double MAX_MASS = 100.0;

    public Node {
        if (metadata == null) metadata = Metadata.empty();
        if (category == null) category = NodeCategory.STATIC;
        if (description == null) description = "";
    }

    public static double clampMass(double mass) {
        if (Double.isNaN(mass)) return MIN_MASS;
        return Math.min(MAX_MASS, Math.max(MIN_MASS, mass));
    }

    public Layer layer() {
        return Layer.fromZIndex(zIndex);
    }

    public boolean isRedirected() {
        return redirectedTo != null;
    }

    public Node withMass(double newMass) {
        return new Node(id, label, type, x, y, zIndex, clampMass(newMass), category, similaritySignature,
                createdAt, lastAccessed, accessCount, clusterId, description, metadata, redirectedTo,
                lastDecayAppliedAt, version);
    }

    public Node withMetadata(Metadata newMetadata) {
        return new Node(id, label, type, x, y, zIndex, mass, category, similaritySignature,
                createdAt, lastAccessed, accessCount, clusterId, description, newMetadata, redirectedTo,
                lastDecayAppliedAt, version);
    }

    public Node withRedirectedTo(String survivorId) {
        return new Node(id, label, type, x, y, zIndex, mass, category, similaritySignature,
                createdAt, lastAccessed, accessCount, clusterId, description, metadata, survivorId,
                lastDecayAppliedAt, version);
    }
}
