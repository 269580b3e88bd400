package io.databrain.replay;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of one export run for one profile.
 *
 * @param file export file, null when nothing was written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplayReport(
        @JsonProperty("profile") String profile,
        @JsonProperty("samples_written") int samplesWritten,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("file") String file,
        @JsonProperty("export_batch") String exportBatch
) {
    public ReplayReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
