package io.databrain.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.databrain.graph.Neighbor;
import io.databrain.graph.Node;

import java.util.List;

/**
 * Answer to a context query: the best-matching node and its ranked neighbors.
 * An empty context has no primary and no neighbors.
 *
 * @param query     the query as received
 * @param primary   best match, or null when nothing cleared the minimum score
 * @param score     similarity score of the primary, 0 when empty
 * @param neighbors neighbors of the primary, strongest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainContext(String query, Node primary, double score, List<Neighbor> neighbors) {

    public BrainContext {
        neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
    }

    public static BrainContext empty(String query) {
        return new BrainContext(query, null, 0.0, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return primary == null;
    }
}
