package io.databrain.mutation;

import io.databrain.config.BrainProperties;
import io.databrain.error.BrainException;
import io.databrain.error.ConflictException;
import io.databrain.error.NotFoundException;
import io.databrain.error.StoreUnavailableException;
import io.databrain.error.ValidationException;
import io.databrain.graph.ForceField;
import io.databrain.graph.GraphStore;
import io.databrain.graph.GraphTransaction;
import io.databrain.graph.Link;
import io.databrain.graph.LinkType;
import io.databrain.graph.Metadata;
import io.databrain.graph.Node;
import io.databrain.graph.NodeCategory;
import io.databrain.graph.NodeType;
import io.databrain.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The only writer of graph state.
 *
 * <p>Each action is validated, executed in exactly one store transaction and recorded with exactly
 * one {@link MutationLogEntry}. Successful actions log inside their own transaction; failed ones
 * log in a separate transaction after the rollback. Optimistic-concurrency conflicts are retried
 * with jittered exponential backoff up to the configured attempt count.</p>
 */
@Service
public class MutationEngine {

    private static final Logger log = LoggerFactory.getLogger(MutationEngine.class);

    static final double DEFAULT_INITIAL_MASS = 20.0;
    static final double DEFAULT_MASS_DELTA = 5.0;
    static final double DEFAULT_LINK_WEIGHT = 0.5;
    static final double EXPLICIT_DECAY_FACTOR = 0.8;

    private final GraphStore store;
    private final SimilarityScorer scorer;
    private final Clock clock;
    private final int maxAttempts;
    private final long backoffMs;
    private final long maxBackoffMs;

    public MutationEngine(GraphStore store, SimilarityScorer scorer, BrainProperties properties, Clock clock) {
        this.store = store;
        this.scorer = scorer;
        this.clock = clock;
        this.maxAttempts = properties.mutation().maxAttempts();
        this.backoffMs = properties.mutation().backoffMs();
        this.maxBackoffMs = properties.mutation().maxBackoffMs();
    }

    /**
     * Applies each request independently. One failed action never affects the others.
     */
    public List<MutationOutcome> applyAll(List<MutationRequest> requests, MutationContext context) {
        if (requests == null || requests.isEmpty()) return List.of();
        List<MutationOutcome> outcomes = new ArrayList<>(requests.size());
        for (MutationRequest request : requests) {
            outcomes.add(apply(request, context));
        }
        return outcomes;
    }

    /**
     * Applies one agent-callable action. Never throws for a classified failure.
     */
    public MutationOutcome apply(MutationRequest request, MutationContext context) {
        String actionName = request.action() == null ? "" : request.action().trim();
        MutationParams params = new MutationParams(request.params());
        MutationAction action;
        try {
            action = MutationAction.fromAgentName(actionName);
        } catch (ValidationException e) {
            recordFailure(actionName.isEmpty() ? "UNKNOWN" : actionName, params, context, e);
            return MutationOutcome.failure(actionName, e, 0);
        }
        return execute(action, params, context);
    }

    /**
     * Registers a layout force field. Logged as {@code DEFINE_FORCE_FIELD}.
     */
    public MutationOutcome defineForceField(Map<String, Object> params, MutationContext context) {
        return execute(MutationAction.DEFINE_FORCE_FIELD, new MutationParams(params), context);
    }

    /**
     * Best-effort recency bump for a context read: increments the node's access counter and
     * marks the returned links as traversed. Not logged. Gives up after {@code lockTimeout}.
     *
     * @return whether the bump committed
     */
    public boolean recordAccess(String nodeId, List<String> traversedLinkIds, Duration lockTimeout) {
        Instant now = clock.instant();
        try {
            store.inTransaction(lockTimeout, tx -> {
                tx.recordAccess(nodeId, now);
                for (String linkId : traversedLinkIds) {
                    tx.markTraversed(linkId, now);
                }
                return null;
            });
            return true;
        } catch (BrainException e) {
            log.debug("Skipped access bump for {}: {}", nodeId, e.getMessage());
            return false;
        }
    }

    /**
     * Scheduled decay of one node: {@code mass = max(mass * factor, 1.0)}, applied only when the
     * node has not been decayed since {@code notDecayedSince}. Logged as {@code TEMPORAL_DECAY}
     * when applied; a skipped node leaves no trace.
     *
     * @return the decayed node, or empty when it was already decayed in this window
     * @throws BrainException when the store fails; the failure is logged first
     */
    public Optional<Node> applyTemporalDecay(String nodeId, double factor, Instant notDecayedSince,
                                             Map<String, Object> details, MutationContext context) {
        Map<String, Object> logged = new LinkedHashMap<>(details);
        logged.put("factor", factor);
        MutationParams params = new MutationParams(logged);
        Instant now = clock.instant();
        try {
            return store.inTransaction(tx -> {
                Optional<Node> decayed = tx.applyTemporalDecay(nodeId, factor, now, notDecayedSince);
                decayed.ifPresent(node -> tx.appendLog(entry(MutationAction.TEMPORAL_DECAY.name(),
                        nodeId, null, params, context, true, null, now)));
                return decayed;
            });
        } catch (BrainException e) {
            recordFailure(MutationAction.TEMPORAL_DECAY.name(), nodeId, null, params, context, e);
            throw e;
        }
    }

    // ---- execution & retry ----

    private MutationOutcome execute(MutationAction action, MutationParams params, MutationContext context) {
        String name = action.name();
        int attempt = 0;
        while (true) {
            attempt++;
            Instant now = clock.instant();
            try {
                Applied applied = store.inTransaction(tx -> {
                    Applied result = dispatch(action, params, tx, now);
                    tx.appendLog(entry(name, result.targetId(), result.sourceId(), params, context, true, null, now));
                    return result;
                });
                log.debug("{} committed on attempt {}: {}", name, attempt, applied.result());
                return MutationOutcome.success(name, applied.result(), attempt);
            } catch (ConflictException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} gave up after {} conflicting attempts: {}", name, attempt, e.getMessage());
                    recordFailure(name, params, context, e);
                    return MutationOutcome.failure(name, e, attempt);
                }
                if (!backoff(attempt)) {
                    ConflictException interrupted = new ConflictException("Interrupted while retrying: " + e.getMessage());
                    recordFailure(name, params, context, interrupted);
                    return MutationOutcome.failure(name, interrupted, attempt);
                }
            } catch (BrainException e) {
                log.debug("{} failed ({}): {}", name, e.kind(), e.getMessage());
                recordFailure(name, params, context, e);
                return MutationOutcome.failure(name, e, attempt);
            } catch (RuntimeException e) {
                log.error("{} failed unexpectedly", name, e);
                StoreUnavailableException wrapped = new StoreUnavailableException(
                        "Unexpected failure during " + name + ": " + e.getMessage(), e);
                recordFailure(name, params, context, wrapped);
                return MutationOutcome.failure(name, wrapped, attempt);
            }
        }
    }

    /**
     * Sleeps before the next attempt. Delay doubles per attempt up to the configured maximum,
     * then a random point in its upper half is chosen.
     *
     * @return false if interrupted
     */
    private boolean backoff(int attempt) {
        long ceiling = Math.min(maxBackoffMs, backoffMs << Math.min(attempt - 1, 20));
        long delay = ThreadLocalRandom.current().nextLong(ceiling / 2, ceiling + 1);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Applied dispatch(MutationAction action, MutationParams params, GraphTransaction tx, Instant now) {
        return switch (action) {
            case CREATE_NODE -> createNode(params, tx, now);
            case CREATE_LINK -> createLink(params, tx, now);
            case UPDATE_MASS -> updateMass(params, tx, now);
            case DECAY_NODE -> decayNode(params, tx);
            case MERGE_NODES -> mergeNodes(params, tx);
            case DEFINE_FORCE_FIELD -> defineForceField(params, tx, now);
            case TEMPORAL_DECAY -> throw new ValidationException("TEMPORAL_DECAY is issued by the decay scheduler only");
        };
    }

    // ---- actions ----

    private Applied createNode(MutationParams params, GraphTransaction tx, Instant now) {
        Node node = newNode(
                params.requireString("label"),
                NodeType.fromString(params.optionalString("type").orElse(null)),
                params.doubleValue("initial_mass", params.doubleValue("mass", DEFAULT_INITIAL_MASS)),
                params.optionalString("description").orElse(""),
                params.metadata("metadata"),
                params,
                now);
        Node stored = tx.insertNode(node);

        Map<String, Object> result = nodeResult(stored);
        result.put("layer", stored.layer().displayName());
        return new Applied(stored.id(), null, result);
    }

    private Applied createLink(MutationParams params, GraphTransaction tx, Instant now) {
        String sourceId = params.requireString("source_id");
        Optional<String> targetId = params.optionalString("target_id");
        Optional<String> targetLabel = params.optionalString("target_label");
        if (targetId.isPresent() && targetId.get().equals(sourceId)) {
            throw new ValidationException("Self-loops are not allowed: " + sourceId);
        }
        if (targetId.isEmpty() && targetLabel.isEmpty()) {
            throw new ValidationException("CREATE_LINK needs target_id or target_label");
        }
        double weight = Link.clampStrength(params.doubleValue("weight", DEFAULT_LINK_WEIGHT));
        LinkType linkType = LinkType.fromString(params.optionalString("link_type").orElse(null));

        Node source = requireLive(tx, sourceId);

        // target by id first, then by label, created when only a label is known
        boolean createdTarget = false;
        Optional<Node> byId = targetId.flatMap(tx::findNode);
        Node target;
        if (byId.isPresent()) {
            target = requireLive(tx, byId.get().id());
        } else if (targetLabel.isPresent()) {
            Optional<Node> byLabel = tx.findNodeByLabel(targetLabel.get());
            if (byLabel.isPresent()) {
                target = byLabel.get();
            } else {
                target = tx.insertNode(newNode(targetLabel.get(), NodeType.INFORMATION, DEFAULT_INITIAL_MASS,
                        "", Metadata.empty(), new MutationParams(Map.of()), now));
                createdTarget = true;
            }
        } else {
            throw new NotFoundException("Node", targetId.get());
        }
        if (target.id().equals(source.id())) {
            throw new ValidationException("Self-loops are not allowed: " + source.id());
        }

        Optional<Link> existing = tx.findLink(source.id(), target.id(), linkType);
        Link link;
        if (existing.isPresent()) {
            link = tx.updateLink(existing.get().withStrength(weight));
        } else {
            link = tx.insertLink(new Link("l_" + UUID.randomUUID(), source.id(), target.id(), weight, linkType,
                    now, null, 0, weight, params.metadata("metadata")));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("link_id", link.id());
        result.put("source_id", link.sourceId());
        result.put("target_id", link.targetId());
        result.put("strength", link.strength());
        result.put("link_type", link.linkType().wireName());
        result.put("reinforced", existing.isPresent());
        result.put("created_target", createdTarget);
        return new Applied(target.id(), source.id(), result);
    }

    private Applied updateMass(MutationParams params, GraphTransaction tx, Instant now) {
        String id = params.requireString("target_id");
        double delta = params.doubleValue("delta", DEFAULT_MASS_DELTA);
        Node before = requireLive(tx, id);

        tx.applyMassDelta(id, delta);
        Node after = tx.recordAccess(id, now);

        Map<String, Object> result = nodeResult(after);
        result.put("mass_before", before.mass());
        result.put("access_count", after.accessCount());
        return new Applied(id, null, result);
    }

    private Applied decayNode(MutationParams params, GraphTransaction tx) {
        String id = params.requireString("target_id");
        String reason = params.optionalString("reason").orElse("explicit decay");
        Node before = requireLive(tx, id);

        Node decayed = before
                .withMass(Math.max(before.mass() * EXPLICIT_DECAY_FACTOR, Node.MIN_MASS))
                .withMetadata(before.metadata().with(Metadata.DECAY_REASON, reason));
        Node stored = tx.upsertNode(decayed, before.version());

        Map<String, Object> result = nodeResult(stored);
        result.put("mass_before", before.mass());
        return new Applied(id, null, result);
    }

    private Applied mergeNodes(MutationParams params, GraphTransaction tx) {
        String winnerId = params.requireString("winner_id");
        String loserId = params.requireString("loser_id");
        if (winnerId.equals(loserId)) {
            throw new ValidationException("Cannot merge a node into itself: " + winnerId);
        }
        Node winner = requireLive(tx, winnerId);
        Node loser = requireLive(tx, loserId);

        // winner links keyed by (source, target, type), ignoring those that touch the loser
        Map<String, Link> byKey = new HashMap<>();
        for (Link link : tx.listLinks(winnerId)) {
            if (!link.touches(loserId)) {
                byKey.put(linkKey(link.sourceId(), link.targetId(), link.linkType()), link);
            }
        }

        int rewired = 0;
        int deduplicated = 0;
        int dropped = 0;
        for (Link link : tx.listLinks(loserId)) {
            String newSource = link.sourceId().equals(loserId) ? winnerId : link.sourceId();
            String newTarget = link.targetId().equals(loserId) ? winnerId : link.targetId();
            if (newSource.equals(newTarget)) {
                tx.deleteLink(link.id());
                dropped++;
                continue;
            }
            String key = linkKey(newSource, newTarget, link.linkType());
            Link parallel = byKey.get(key);
            if (parallel == null) {
                Link moved = tx.updateLink(link.withEndpoints(newSource, newTarget));
                byKey.put(key, moved);
                rewired++;
            } else {
                tx.deleteLink(link.id());
                if (link.strength() > parallel.strength()) {
                    byKey.put(key, tx.updateLink(parallel.withStrength(link.strength())));
                }
                deduplicated++;
            }
        }

        List<Object> mergedFrom = new ArrayList<>();
        winner.metadata().get(Metadata.MERGED_FROM).ifPresent(previous -> {
            if (previous instanceof List<?> list) mergedFrom.addAll(list);
        });
        mergedFrom.add(loserId);

        Node survivor = tx.upsertNode(
                winner.withMass(winner.mass() + loser.mass())
                        .withMetadata(winner.metadata().with(Metadata.MERGED_FROM, mergedFrom)),
                winner.version());
        tx.upsertNode(loser.withRedirectedTo(winnerId), loser.version());

        Map<String, Object> result = nodeResult(survivor);
        result.put("loser_id", loserId);
        result.put("links_rewired", rewired);
        result.put("links_deduplicated", deduplicated);
        result.put("links_dropped", dropped);
        return new Applied(winnerId, loserId, result);
    }

    private Applied defineForceField(MutationParams params, GraphTransaction tx, Instant now) {
        String label = params.requireString("label");
        String id = params.optionalString("field_id").orElse("ff_" + UUID.randomUUID());
        int radius = params.optionalInt("radius").orElse(ForceField.DEFAULT_RADIUS);
        if (radius <= 0) {
            throw new ValidationException("Force field radius must be positive: " + radius);
        }
        double strength = params.doubleValue("strength", ForceField.DEFAULT_STRENGTH);
        if (strength < 0.0 || strength > 1.0) {
            throw new ValidationException("Force field strength must be within [0, 1]: " + strength);
        }
        ForceField field = tx.insertForceField(new ForceField(id, label,
                params.requireDouble("x"), params.requireDouble("y"), radius, strength,
                scorer.signature(label, ""), now));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("field_id", field.id());
        result.put("label", field.label());
        result.put("radius", field.radius());
        result.put("strength", field.strength());
        return new Applied(null, null, result);
    }

    // ---- helpers ----

    private Node newNode(String label, NodeType type, double mass, String description, Metadata metadata,
                         MutationParams params, Instant now) {
        String id = "n_" + UUID.randomUUID();
        int zIndex = params.optionalInt("z_index").orElse(type.canonicalZIndex());
        if (zIndex < 0) {
            throw new ValidationException("z_index must not be negative: " + zIndex);
        }
        // layout position defaults to a stable spot derived from id and label
        double x = params.doubleValue("x", 500 + Math.floorMod(id.hashCode(), 200));
        double y = params.doubleValue("y", 400 + Math.floorMod(label.hashCode(), 200));
        return new Node(id, label, type, x, y, zIndex, Node.clampMass(mass),
                NodeCategory.fromString(params.optionalString("category").orElse(null)),
                scorer.signature(label, description),
                now, now, 0, params.optionalInt("cluster_id").orElse(0),
                description, metadata, null, null, 0);
    }

    /**
     * The node under {@code id}, which must exist and must not have been merged away.
     */
    private static Node requireLive(GraphTransaction tx, String id) {
        Node node = tx.findNode(id).orElseThrow(() -> new NotFoundException("Node", id));
        if (node.isRedirected()) {
            throw new ValidationException("Node %s was merged into %s".formatted(id, node.redirectedTo()));
        }
        return node;
    }

    private static Map<String, Object> nodeResult(Node node) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("node_id", node.id());
        result.put("label", node.label());
        result.put("type", node.type().wireName());
        result.put("mass", node.mass());
        result.put("z_index", node.zIndex());
        return result;
    }

    private static String linkKey(String sourceId, String targetId, LinkType type) {
        return sourceId + "|" + targetId + "|" + type.wireName();
    }

    private MutationLogEntry entry(String action, String targetId, String sourceId, MutationParams params,
                                   MutationContext context, boolean success, String error, Instant at) {
        return new MutationLogEntry(0, action, targetId, sourceId, params.asMap(),
                params.firstReference("reason"), context.triggeredBy(), context.sessionId(),
                success, error, at);
    }

    private void recordFailure(String action, MutationParams params, MutationContext context, BrainException e) {
        recordFailure(action,
                params.firstReference("target_id", "winner_id", "target_label", "label"),
                params.firstReference("source_id", "loser_id"),
                params, context, e);
    }

    private void recordFailure(String action, String targetId, String sourceId, MutationParams params,
                               MutationContext context, BrainException e) {
        MutationLogEntry failed = entry(action, targetId, sourceId, params, context, false,
                e.kind() + ": " + e.getMessage(), clock.instant());
        try {
            store.inTransaction(tx -> tx.appendLog(failed));
        } catch (BrainException logFailure) {
            log.error("Could not record failed {} in the mutation log (original error: {})",
                    action, e.getMessage(), logFailure);
        }
    }

    private record Applied(String targetId, String sourceId, Map<String, Object> result) {
    }
}
