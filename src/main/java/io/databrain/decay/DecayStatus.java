package io.databrain.decay;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of how mass is spread across live nodes, split by the inactivity window.
 */
public record DecayStatus(
        @JsonProperty("active_nodes") long activeNodes,
        @JsonProperty("avg_active_mass") double avgActiveMass,
        @JsonProperty("inactive_nodes") long inactiveNodes,
        @JsonProperty("avg_inactive_mass") double avgInactiveMass,
        @JsonProperty("nodes_at_minimum") long nodesAtMinimum,
        @JsonProperty("mass_distribution") Map<String, Long> massDistribution,
        @JsonProperty("inactivity_days") int inactivityDays,
        @JsonProperty("half_life_days") double halfLifeDays
) {
}
