package io.databrain.replay;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One instruction/response training record, written as a single JSONL line.
 */
public record ReplaySample(
        @JsonProperty("instruction") String instruction,
        @JsonProperty("input") String input,
        @JsonProperty("output") String output,
        @JsonProperty("source_node_ids") List<String> sourceNodeIds,
        @JsonProperty("layer") String layer,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("profile") String profile,
        @JsonProperty("export_batch") String exportBatch
) {
    public ReplaySample {
        sourceNodeIds = sourceNodeIds == null ? List.of() : List.copyOf(sourceNodeIds);
        if (input == null) input = "";
    }

    ReplaySample withExportBatch(String batch) {
        return new ReplaySample(instruction, input, output, sourceNodeIds, layer, confidence, profile, batch);
    }
}
