package io.databrain.similarity;

import io.databrain.graph.Node;

/**
 * Pluggable relevance scoring between a free-text query and a node.
 * Implementations must be deterministic and thread-safe.
 */
public interface SimilarityScorer {

    /**
     * Precomputed signature stored with the node at write time. Opaque to the store.
     */
    String signature(String label, String description);

    /**
     * Relevance of {@code node} to {@code query} in [0, 1]. Zero for a blank query.
     */
    double score(String query, Node node);
}
