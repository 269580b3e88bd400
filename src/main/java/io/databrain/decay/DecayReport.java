package io.databrain.decay;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one decay run.
 *
 * @param nodesScanned inactive nodes examined
 * @param nodesDecayed nodes whose mass was reduced
 * @param nodesSkipped nodes already decayed today or inactive for less than a day since the last decay
 * @param errors       one message per node that failed
 * @param ranAt        run timestamp
 */
public record DecayReport(
        @JsonProperty("nodes_scanned") int nodesScanned,
        @JsonProperty("nodes_decayed") int nodesDecayed,
        @JsonProperty("nodes_skipped") int nodesSkipped,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("ran_at") Instant ranAt
) {
    public DecayReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
