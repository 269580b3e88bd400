package io.databrain.brain;

import io.databrain.decay.DecayReport;
import io.databrain.decay.DecayScheduler;
import io.databrain.decay.DecayStatus;
import io.databrain.error.ValidationException;
import io.databrain.graph.ForceField;
import io.databrain.graph.GraphStore;
import io.databrain.graph.Link;
import io.databrain.graph.Node;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationEngine;
import io.databrain.mutation.MutationLogEntry;
import io.databrain.mutation.MutationOutcome;
import io.databrain.mutation.MutationRequest;
import io.databrain.replay.ReplayExporter;
import io.databrain.replay.ReplayReport;
import io.databrain.retrieval.BrainContext;
import io.databrain.retrieval.ContextRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The brain as seen by its callers: one injected instance shared by every agent, tool and
 * endpoint. Concurrency is arbitrated by the store; this class holds no locks.
 */
@Service
public class DataBrain {

    private static final Logger log = LoggerFactory.getLogger(DataBrain.class);
    static final int MAX_LOG_LIMIT = 1000;

    private final ContextRetriever contextRetriever;
    private final MutationEngine mutationEngine;
    private final GraphStore store;
    private final DecayScheduler decayScheduler;
    private final ReplayExporter replayExporter;

    public DataBrain(ContextRetriever contextRetriever, MutationEngine mutationEngine, GraphStore store,
                     DecayScheduler decayScheduler, ReplayExporter replayExporter) {
        this.contextRetriever = contextRetriever;
        this.mutationEngine = mutationEngine;
        this.store = store;
        this.decayScheduler = decayScheduler;
        this.replayExporter = replayExporter;
    }

    public BrainContext getBrainContext(String query, Integer maxNeighbors) {
        return contextRetriever.getBrainContext(query, maxNeighbors);
    }

    /**
     * Applies each action independently and reports one outcome per action, in request order.
     */
    public List<MutationOutcome> mutateBrain(List<MutationRequest> actions, MutationContext context) {
        List<MutationOutcome> outcomes = mutationEngine.applyAll(actions, context);
        long failed = outcomes.stream().filter(o -> !o.success()).count();
        log.info("mutate_brain from {}: {} actions, {} failed", context.triggeredBy(), outcomes.size(), failed);
        return outcomes;
    }

    /**
     * Same as {@link #mutateBrain(List, MutationContext)}, run on the caller's executor.
     */
    public CompletableFuture<List<MutationOutcome>> mutateBrainAsync(List<MutationRequest> actions,
                                                                    MutationContext context,
                                                                    Executor executor) {
        return CompletableFuture.supplyAsync(() -> mutateBrain(actions, context), executor);
    }

    public CompletableFuture<BrainContext> getBrainContextAsync(String query, Integer maxNeighbors,
                                                               Executor executor) {
        return CompletableFuture.supplyAsync(() -> getBrainContext(query, maxNeighbors), executor);
    }

    /** Node by id, following merge redirects. */
    public Node getNode(String id) {
        return store.getNode(id);
    }

    public List<Link> getLinks(String nodeId) {
        return store.listLinks(store.getNode(nodeId).id());
    }

    public List<MutationLogEntry> recentMutations(int limit) {
        return store.recentMutations(checkLimit(limit));
    }

    public List<MutationLogEntry> mutationsForNode(String nodeId, int limit) {
        return store.mutationsForNode(nodeId, checkLimit(limit));
    }

    public MutationOutcome defineForceField(Map<String, Object> params, MutationContext context) {
        return mutationEngine.defineForceField(params, context);
    }

    public List<ForceField> forceFields() {
        return store.listForceFields();
    }

    public DecayReport runDecay() {
        return decayScheduler.run();
    }

    public DecayStatus decayStatus() {
        return decayScheduler.status();
    }

    public ReplayReport exportReplay(String profile) {
        return replayExporter.run(profile);
    }

    public long nodeCount() {
        return store.countNodes();
    }

    public boolean isHealthy() {
        return store.healthCheck();
    }

    private static int checkLimit(int limit) {
        if (limit <= 0 || limit > MAX_LOG_LIMIT) {
            throw new ValidationException("limit must be between 1 and %d: %d".formatted(MAX_LOG_LIMIT, limit));
        }
        return limit;
    }
}
