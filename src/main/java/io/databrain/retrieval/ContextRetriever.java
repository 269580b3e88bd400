package io.databrain.retrieval;

import io.databrain.config.BrainProperties;
import io.databrain.error.ValidationException;
import io.databrain.graph.GraphStore;
import io.databrain.graph.Neighbor;
import io.databrain.graph.ScoredNode;
import io.databrain.mutation.MutationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Read path for agents: query → best match plus ranked neighbors.
 *
 * <p>Reads never wait on writers. The access bump that follows a hit goes through the
 * {@link MutationEngine} with a short lock timeout and is dropped under contention.</p>
 */
@Service
public class ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(ContextRetriever.class);

    private final GraphStore store;
    private final MutationEngine mutationEngine;
    private final int defaultMaxNeighbors;
    private final int maxNeighborsLimit;
    private final Duration touchTimeout;

    public ContextRetriever(GraphStore store, MutationEngine mutationEngine, BrainProperties properties) {
        this.store = store;
        this.mutationEngine = mutationEngine;
        this.defaultMaxNeighbors = properties.context().defaultMaxNeighbors();
        this.maxNeighborsLimit = properties.context().maxNeighborsLimit();
        this.touchTimeout = properties.context().touchTimeout();
    }

    /**
     * @param query        free text
     * @param maxNeighbors neighbors wanted; null for the default, capped at the configured limit
     * @return the context, empty when no node scores at or above the minimum
     * @throws ValidationException if {@code maxNeighbors} is negative
     */
    public BrainContext getBrainContext(String query, Integer maxNeighbors) {
        if (maxNeighbors != null && maxNeighbors < 0) {
            throw new ValidationException("max_neighbors must not be negative: " + maxNeighbors);
        }
        if (query == null || query.isBlank()) {
            return BrainContext.empty(query);
        }
        int limit = Math.min(maxNeighbors == null ? defaultMaxNeighbors : maxNeighbors, maxNeighborsLimit);

        List<ScoredNode> matches = store.findBySimilarity(query.trim(), 1);
        if (matches.isEmpty()) {
            log.debug("No node matches '{}' above the minimum score", query);
            return BrainContext.empty(query);
        }
        ScoredNode best = matches.get(0);
        List<Neighbor> neighbors = store.listNeighbors(best.node().id(), limit);

        boolean touched = mutationEngine.recordAccess(best.node().id(),
                neighbors.stream().map(n -> n.link().id()).toList(), touchTimeout);
        if (!touched) {
            log.debug("Access bump for {} skipped", best.node().id());
        }
        return new BrainContext(query, best.node(), best.score(), neighbors);
    }
}
