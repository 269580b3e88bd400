package io.databrain.graph;

/**
 * A similarity search hit.
 */
public record ScoredNode(Node node, double score) {
}
