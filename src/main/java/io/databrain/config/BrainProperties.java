package io.databrain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the brain.
 *
 * <p>Binds to {@code databrain.*} in application.yml:</p>
 * <pre>
 * databrain:
 *   store:
 *     path: ./data/brain/brain.db
 *     timeout-ms: 5000
 *   similarity:
 *     min-score: 0.5
 *     page-size: 1000
 *   mutation:
 *     max-attempts: 5
 *     backoff-ms: 20
 *     max-backoff-ms: 500
 *   context:
 *     default-max-neighbors: 5
 *     max-neighbors-limit: 50
 *     touch-timeout-ms: 50
 *   decay:
 *     cron: "0 2 * * *"
 *     inactivity-days: 7
 *     half-life-days: 30
 *     batch-size: 1000
 *   replay:
 *     cron: "0 3 * * 0"
 *     mass-threshold: 30
 *     min-access-count: 5
 *     max-nodes: 50
 *     export-dir: ./data/replay
 *     profiles: [default]
 * </pre>
 * Every section and every value may be omitted; missing values fall back to the defaults above.
 */
@ConfigurationProperties(prefix = "databrain")
public record BrainProperties(
        Store store,
        Similarity similarity,
        Mutation mutation,
        Context context,
        Decay decay,
        Replay replay
) {

    public BrainProperties {
        if (store == null) store = new Store(null, 0);
        if (similarity == null) similarity = new Similarity(null, 0);
        if (mutation == null) mutation = new Mutation(0, 0, 0);
        if (context == null) context = new Context(0, 0, 0);
        if (decay == null) decay = new Decay(null, null, 0, 0, 0);
        if (replay == null) replay = new Replay(null, null, null, null, 0, null, null);
    }

    /** All defaults. */
    public static BrainProperties defaults() {
        return new BrainProperties(null, null, null, null, null, null);
    }

    /**
     * @param path      SQLite database file
     * @param timeoutMs busy timeout for every store connection
     */
    public record Store(String path, long timeoutMs) {
        public Store {
            if (path == null || path.isBlank()) path = "./data/brain/brain.db";
            if (timeoutMs <= 0) timeoutMs = 5000;
        }

        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    /**
     * @param minScore       results scoring below this are never returned
     * @param pageSize live nodes read per page while scoring a query; every live node is scored
     */
    public record Similarity(Double minScore, int pageSize) {
        public Similarity {
            if (minScore == null) minScore = 0.5;
            if (pageSize <= 0) pageSize = 1000;
        }
    }

    public record Mutation(int maxAttempts, long backoffMs, long maxBackoffMs) {
        public Mutation {
            if (maxAttempts <= 0) maxAttempts = 5;
            if (backoffMs <= 0) backoffMs = 20;
            if (maxBackoffMs <= 0) maxBackoffMs = 500;
        }
    }

    /**
     * @param defaultMaxNeighbors neighbors returned when the caller does not say
     * @param maxNeighborsLimit   hard cap on requested neighbors
     * @param touchTimeoutMs      lock wait for the best-effort access bump
     */
    public record Context(int defaultMaxNeighbors, int maxNeighborsLimit, long touchTimeoutMs) {
        public Context {
            if (defaultMaxNeighbors <= 0) defaultMaxNeighbors = 5;
            if (maxNeighborsLimit <= 0) maxNeighborsLimit = 50;
            if (touchTimeoutMs <= 0) touchTimeoutMs = 50;
        }

        public Duration touchTimeout() {
            return Duration.ofMillis(touchTimeoutMs);
        }
    }

    /** @param batchSize inactive nodes read per page; a run pages through all of them */
    public record Decay(Boolean enabled, String cron, int inactivityDays, double halfLifeDays, int batchSize) {
        public Decay {
            if (enabled == null) enabled = true;
            if (cron == null || cron.isBlank()) cron = "0 2 * * *";
            if (inactivityDays <= 0) inactivityDays = 7;
            if (halfLifeDays <= 0) halfLifeDays = 30;
            if (batchSize <= 0) batchSize = 1000;
        }
    }

    public record Replay(
            Boolean enabled,
            String cron,
            Double massThreshold,
            Integer minAccessCount,
            int maxNodes,
            String exportDir,
            List<String> profiles
    ) {
        public Replay {
            if (enabled == null) enabled = true;
            if (cron == null || cron.isBlank()) cron = "0 3 * * 0";
            if (massThreshold == null) massThreshold = 30.0;
            if (minAccessCount == null) minAccessCount = 5;
            if (maxNodes <= 0) maxNodes = 50;
            if (exportDir == null || exportDir.isBlank()) exportDir = "./data/replay";
            if (profiles == null || profiles.isEmpty()) profiles = List.of("default");
        }
    }
}
