package io.databrain.decay;

import io.databrain.config.BrainProperties;
import io.databrain.error.BrainException;
import io.databrain.graph.GraphStats;
import io.databrain.graph.GraphStore;
import io.databrain.graph.Node;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exponential decay of inactive nodes.
 *
 * <p>A node qualifies when its {@code last_accessed} is older than the inactivity window and its
 * mass is above the floor. Decay covers the whole days elapsed since the later of its last access
 * and its last scheduled decay: {@code mass * 0.5^(days / halfLife)}, floored at 1.0. Each node is
 * decayed at most once per UTC calendar day, so re-running on the same day changes nothing.</p>
 */
@Service
public class DecayScheduler {

    private static final Logger log = LoggerFactory.getLogger(DecayScheduler.class);
    static final String TRIGGERED_BY = "temporal_decay";

    private final GraphStore store;
    private final MutationEngine mutationEngine;
    private final Clock clock;
    private final int inactivityDays;
    private final double halfLifeDays;
    private final int batchSize;

    public DecayScheduler(GraphStore store, MutationEngine mutationEngine, BrainProperties properties, Clock clock) {
        this.store = store;
        this.mutationEngine = mutationEngine;
        this.clock = clock;
        this.inactivityDays = properties.decay().inactivityDays();
        this.halfLifeDays = properties.decay().halfLifeDays();
        this.batchSize = properties.decay().batchSize();
    }

    public DecayReport run() {
        Instant now = clock.instant();
        Instant today = now.truncatedTo(ChronoUnit.DAYS);
        Instant cutoff = now.minus(Duration.ofDays(inactivityDays));
        MutationContext context = MutationContext.system(TRIGGERED_BY);

        int scanned = 0;
        int decayed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        Node cursor = null;
        List<Node> page;
        do {
            page = store.scanInactive(cutoff, cursor, batchSize);
            for (Node node : page) {
                try {
                    if (decay(node, now, today, context)) {
                        decayed++;
                    } else {
                        skipped++;
                    }
                } catch (BrainException e) {
                    log.warn("Decay failed for {}: {}", node.id(), e.getMessage());
                    errors.add(node.id() + ": " + e.getMessage());
                }
            }
            scanned += page.size();
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1);
            }
        } while (page.size() == batchSize);
        log.info("Decay run: {} nodes inactive since {}", scanned, cutoff);

        DecayReport report = new DecayReport(scanned, decayed, skipped, errors, now);
        log.info("Decay run complete: scanned={}, decayed={}, skipped={}, errors={}",
                report.nodesScanned(), report.nodesDecayed(), report.nodesSkipped(), errors.size());
        return report;
    }

    /** Returns false when the node needs no decay or was already decayed today. */
    private boolean decay(Node node, Instant now, Instant today, MutationContext context) {
        long days = Duration.between(referencePoint(node), now).toDays();
        if (days <= 0) {
            return false;
        }
        double factor = Math.pow(0.5, days / halfLifeDays);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("days_inactive", days);
        details.put("half_life_days", halfLifeDays);
        details.put("mass_before", node.mass());
        Optional<Node> result = mutationEngine.applyTemporalDecay(node.id(), factor, today, details, context);
        result.ifPresent(decayedNode -> log.debug("Decayed {} '{}': {} -> {}",
                node.id(), node.label(), node.mass(), decayedNode.mass()));
        return result.isPresent();
    }

    public DecayStatus status() {
        Instant activeSince = clock.instant().minus(Duration.ofDays(inactivityDays));
        GraphStats stats = store.stats(activeSince);

        Map<String, Long> distribution = new LinkedHashMap<>();
        distribution.put("1-10", stats.massUpTo10());
        distribution.put("10-50", stats.mass10To50());
        distribution.put("50-100", stats.mass50To100());
        return new DecayStatus(stats.activeCount(), round2(stats.avgActiveMass()),
                stats.inactiveCount(), round2(stats.avgInactiveMass()),
                stats.nodesAtMinimum(), distribution, inactivityDays, halfLifeDays);
    }

    private static Instant referencePoint(Node node) {
        Instant lastAccessed = node.lastAccessed();
        Instant lastDecay = node.lastDecayAppliedAt();
        if (lastDecay == null) return lastAccessed;
        return lastDecay.isAfter(lastAccessed) ? lastDecay : lastAccessed;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
