package io.databrain.graph;

import io.databrain.mutation.MutationLogEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for nodes, links, force fields and the mutation log.
 *
 * <p>Read methods run outside any write transaction and never wait on writers.
 * All writes go through {@link #inTransaction(TransactionWork)}.</p>
 */
public interface GraphStore {

    /** Raw row lookup, no redirect resolution. */
    Optional<Node> findNode(String id);

    /**
     * Returns the node, following {@code redirected_to} to the surviving node.
     *
     * @throws io.databrain.error.NotFoundException if the id (or a node on its redirect chain) is unknown
     */
    Node getNode(String id);

    Optional<Node> findNodeByLabel(String label);

    /**
     * Live neighbors over links in either direction, one entry per neighbor, ordered by link
     * strength desc, neighbor mass desc, last traversal desc, neighbor id asc.
     */
    List<Neighbor> listNeighbors(String nodeId, int maxNeighbors);

    List<Link> listLinks(String nodeId);

    /**
     * Live nodes scoring at or above the configured minimum for {@code query}, best first.
     * Equal scores are ordered by mass desc, then last access desc, then id.
     */
    List<ScoredNode> findBySimilarity(String query, int topK);

    /**
     * Live nodes with {@code mass >= minMass}, {@code z_index >= minZIndex} and at least
     * {@code minAccessCount} accesses, heaviest first, then by access count desc and id.
     */
    List<Node> scanByMassDesc(double minMass, int minZIndex, long minAccessCount, int limit);

    /**
     * Live nodes above the mass floor last accessed before {@code accessedBefore}, ordered by
     * (last access, id). Pass the last node of the previous page as {@code after}, or null to start.
     */
    List<Node> scanInactive(Instant accessedBefore, Node after, int limit);

    GraphStats stats(Instant activeSince);

    List<ForceField> listForceFields();

    /** Most recent log entries, newest first, ordered by (timestamp, id). */
    List<MutationLogEntry> recentMutations(int limit);

    List<MutationLogEntry> mutationsForNode(String nodeId, int limit);

    long countNodes();

    boolean healthCheck();

    <T> T inTransaction(TransactionWork<T> work);

    /**
     * Same as {@link #inTransaction(TransactionWork)} but waits at most {@code lockTimeout}
     * for the write lock.
     */
    <T> T inTransaction(Duration lockTimeout, TransactionWork<T> work);

    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(GraphTransaction tx);
    }
}
