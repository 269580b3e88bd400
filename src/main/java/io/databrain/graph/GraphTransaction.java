package io.databrain.graph;

import io.databrain.mutation.MutationLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operations available inside a single store transaction. Everything done through one
 * instance commits or rolls back together.
 */
public interface GraphTransaction {

    /** Raw row lookup; redirects are <em>not</em> followed. */
    Optional<Node> findNode(String id);

    /** Highest-mass live node carrying exactly this label. */
    Optional<Node> findNodeByLabel(String label);

    Node insertNode(Node node);

    /**
     * Writes {@code node} if the stored version still equals {@code expectedVersion}.
     * With {@code expectedVersion == 0} and no stored row, the node is inserted.
     *
     * @throws io.databrain.error.ConflictException if the stored version moved
     * @throws io.databrain.error.NotFoundException if there is no row and {@code expectedVersion != 0}
     */
    Node upsertNode(Node node, long expectedVersion);

    /**
     * Atomic {@code mass = clamp(mass + delta, 1, 100)} on the stored value.
     */
    Node applyMassDelta(String id, double delta);

    /** Bumps {@code access_count} and sets {@code last_accessed}. */
    Node recordAccess(String id, Instant at);

    /**
     * Multiplies mass by {@code factor} (floored at 1.0) and stamps {@code last_decay_applied_at},
     * but only if the node has not been decayed at or after {@code notDecayedSince}.
     *
     * @return the updated node, or empty when the node was already decayed in that window
     */
    Optional<Node> applyTemporalDecay(String id, double factor, Instant appliedAt, Instant notDecayedSince);

    Link insertLink(Link link);

    Link updateLink(Link link);

    void deleteLink(String linkId);

    Optional<Link> findLink(String sourceId, String targetId, LinkType linkType);

    /** All links with {@code nodeId} at either end. */
    List<Link> listLinks(String nodeId);

    void markTraversed(String linkId, Instant at);

    ForceField insertForceField(ForceField field);

    MutationLogEntry appendLog(MutationLogEntry entry);
}
