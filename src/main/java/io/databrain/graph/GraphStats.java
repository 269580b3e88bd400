package io.databrain.graph;

/**
 * Aggregate mass figures over live (non-redirected) nodes.
 */
public record GraphStats(
        long activeCount,
        double avgActiveMass,
        long inactiveCount,
        double avgInactiveMass,
        long nodesAtMinimum,
        long massUpTo10,
        long mass10To50,
        long mass50To100
) {
}
