package io.databrain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.config.BrainProperties;
import io.databrain.error.NotFoundException;
import io.databrain.error.StoreUnavailableException;
import io.databrain.error.ValidationException;
import io.databrain.mutation.MutationLogEntry;
import io.databrain.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * SQLite-backed graph store.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code graph_nodes}: nodes, with mass bounds enforced by a CHECK constraint</li>
 *   <li>{@code graph_links}: directed links, self-loops rejected by a CHECK constraint</li>
 *   <li>{@code force_fields}: layout attractors</li>
 *   <li>{@code neuroplasticity_log}: append-only mutation log</li>
 * </ul>
 *
 * <p>The database runs in WAL mode. Every operation opens its own connection: reads run in
 * autocommit mode and never wait on writers, writes run inside {@code BEGIN IMMEDIATE} so that
 * writers are serialized at the database lock. Timestamps are stored as epoch milliseconds.</p>
 */
@Component
public class SQLiteGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteGraphStore.class);
    private static final int MAX_REDIRECT_DEPTH = 16;

    private static final Comparator<ScoredNode> SIMILARITY_ORDER = Comparator
            .comparingDouble(ScoredNode::score).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredNode s) -> s.node().mass()).reversed())
            .thenComparing(s -> s.node().lastAccessed(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(s -> s.node().id());

    private final Path dbPath;
    private final Duration busyTimeout;
    private final SimilarityScorer scorer;
    private final double minScore;
    private final int pageSize;
    private final ObjectMapper objectMapper;

    @Autowired
    public SQLiteGraphStore(BrainProperties properties, SimilarityScorer scorer, ObjectMapper objectMapper) {
        this.dbPath = Path.of(properties.store().path());
        this.busyTimeout = properties.store().timeout();
        this.scorer = scorer;
        this.minScore = properties.similarity().minScore();
        this.pageSize = properties.similarity().pageSize();
        this.objectMapper = objectMapper;
    }

    /** Constructor for testing with explicit db path and default settings. */
    public SQLiteGraphStore(Path dbPath, SimilarityScorer scorer) {
        BrainProperties defaults = BrainProperties.defaults();
        this.dbPath = dbPath;
        this.busyTimeout = defaults.store().timeout();
        this.scorer = scorer;
        this.minScore = defaults.similarity().minScore();
        this.pageSize = defaults.similarity().pageSize();
        this.objectMapper = new ObjectMapper();
    }

    @PostConstruct
    public void init() {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection conn = open(busyTimeout)) {
                try (var stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL");
                }
                createSchema(conn);
            }
            log.info("SQLiteGraphStore initialized at: {}", dbPath);
        } catch (IOException | SQLException e) {
            log.error("Failed to initialize graph store at {}", dbPath, e);
            throw new StoreUnavailableException("Graph store initialization failed: " + dbPath, e);
        }
    }

    private void createSchema(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS graph_nodes (
                    node_id TEXT PRIMARY KEY,
                    label TEXT NOT NULL,
                    type TEXT NOT NULL DEFAULT 'information',
                    x_coord REAL NOT NULL DEFAULT 0,
                    y_coord REAL NOT NULL DEFAULT 0,
                    z_index INTEGER NOT NULL DEFAULT 150,
                    mass REAL NOT NULL DEFAULT 20 CHECK (mass >= 1.0 AND mass <= 100.0),
                    node_category TEXT NOT NULL DEFAULT 'static',
                    similarity_signature TEXT,
                    created_at INTEGER NOT NULL,
                    last_accessed INTEGER NOT NULL,
                    access_count INTEGER NOT NULL DEFAULT 0,
                    cluster_id INTEGER NOT NULL DEFAULT 0,
                    description TEXT NOT NULL DEFAULT '',
                    metadata TEXT NOT NULL DEFAULT '{}',
                    redirected_to TEXT REFERENCES graph_nodes(node_id),
                    last_decay_applied_at INTEGER,
                    version INTEGER NOT NULL DEFAULT 1
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_label ON graph_nodes(label)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_mass ON graph_nodes(mass DESC)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_last_accessed ON graph_nodes(last_accessed)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_redirected ON graph_nodes(redirected_to)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS graph_links (
                    link_id TEXT PRIMARY KEY,
                    source_node_id TEXT NOT NULL REFERENCES graph_nodes(node_id),
                    target_node_id TEXT NOT NULL REFERENCES graph_nodes(node_id),
                    strength REAL NOT NULL CHECK (strength >= 0.0 AND strength <= 1.0),
                    link_type TEXT NOT NULL DEFAULT 'semantic',
                    created_at INTEGER NOT NULL,
                    last_traversed INTEGER,
                    traversal_count INTEGER NOT NULL DEFAULT 0,
                    weight REAL NOT NULL DEFAULT 0.5,
                    metadata TEXT NOT NULL DEFAULT '{}',
                    CHECK (source_node_id <> target_node_id)
                )
                """);

            stmt.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS idx_links_endpoints
                ON graph_links(source_node_id, target_node_id, link_type)
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_links_target ON graph_links(target_node_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS force_fields (
                    field_id TEXT PRIMARY KEY,
                    label TEXT NOT NULL,
                    x_coord REAL NOT NULL,
                    y_coord REAL NOT NULL,
                    radius INTEGER NOT NULL DEFAULT 150,
                    field_strength REAL NOT NULL DEFAULT 0.5,
                    signature TEXT,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS neuroplasticity_log (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    action TEXT NOT NULL,
                    target_node_id TEXT,
                    source_node_id TEXT,
                    params TEXT NOT NULL DEFAULT '{}',
                    reason TEXT,
                    triggered_by TEXT,
                    session_id TEXT,
                    success INTEGER NOT NULL,
                    error_message TEXT,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_log_created ON neuroplasticity_log(created_at, id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_log_target ON neuroplasticity_log(target_node_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_log_source ON neuroplasticity_log(source_node_id)");
        }
    }

    // ---- reads ----

    @Override
    public Optional<Node> findNode(String id) {
        return read(session -> session.findNode(id));
    }

    @Override
    public Node getNode(String id) {
        return read(session -> {
            String current = id;
            for (int depth = 0; depth <= MAX_REDIRECT_DEPTH; depth++) {
                String lookup = current;
                Node node = session.findNode(lookup).orElseThrow(() -> new NotFoundException("Node", lookup));
                if (!node.isRedirected()) {
                    return node;
                }
                current = node.redirectedTo();
            }
            throw new ValidationException("Redirect chain from %s exceeds %d hops".formatted(id, MAX_REDIRECT_DEPTH));
        });
    }

    @Override
    public Optional<Node> findNodeByLabel(String label) {
        return read(session -> session.findNodeByLabel(label));
    }

    @Override
    public List<Neighbor> listNeighbors(String nodeId, int maxNeighbors) {
        if (maxNeighbors <= 0) return List.of();
        return read(session -> session.listNeighbors(nodeId, maxNeighbors));
    }

    @Override
    public List<Link> listLinks(String nodeId) {
        return read(session -> session.listLinks(nodeId));
    }

    @Override
    public List<ScoredNode> findBySimilarity(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        List<ScoredNode> matches = new ArrayList<>();
        int scanned = 0;
        String cursor = null;
        List<Node> page;
        do {
            String after = cursor;
            page = read(session -> session.liveNodesAfter(after, pageSize));
            for (Node node : page) {
                double score = scorer.score(query, node);
                if (score >= minScore) {
                    matches.add(new ScoredNode(node, score));
                }
            }
            scanned += page.size();
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1).id();
            }
        } while (page.size() == pageSize);

        List<ScoredNode> results = matches.stream()
                .sorted(SIMILARITY_ORDER)
                .limit(topK)
                .toList();
        log.debug("Similarity '{}': {} nodes scored, {} above {}", query, scanned, matches.size(), minScore);
        return results;
    }

    @Override
    public List<Node> scanByMassDesc(double minMass, int minZIndex, long minAccessCount, int limit) {
        return read(session -> session.scanByMassDesc(minMass, minZIndex, minAccessCount, limit));
    }

    @Override
    public List<Node> scanInactive(Instant accessedBefore, Node after, int limit) {
        return read(session -> session.scanInactive(accessedBefore, after, limit));
    }

    @Override
    public GraphStats stats(Instant activeSince) {
        return read(session -> session.stats(activeSince));
    }

    @Override
    public List<ForceField> listForceFields() {
        return read(SQLiteGraphSession::listForceFields);
    }

    @Override
    public List<MutationLogEntry> recentMutations(int limit) {
        return read(session -> session.recentMutations(limit));
    }

    @Override
    public List<MutationLogEntry> mutationsForNode(String nodeId, int limit) {
        return read(session -> session.mutationsForNode(nodeId, limit));
    }

    @Override
    public long countNodes() {
        return read(SQLiteGraphSession::countNodes);
    }

    @Override
    public boolean healthCheck() {
        try (Connection conn = open(busyTimeout);
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Graph store health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ---- writes ----

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        return inTransaction(busyTimeout, work);
    }

    @Override
    public <T> T inTransaction(Duration lockTimeout, TransactionWork<T> work) {
        try (Connection conn = open(lockTimeout)) {
            execute(conn, "BEGIN IMMEDIATE");
            try {
                T result = work.execute(new SQLiteGraphSession(conn, objectMapper));
                execute(conn, "COMMIT");
                return result;
            } catch (RuntimeException | SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            throw SQLiteErrors.translate("transaction", e);
        }
    }

    @PreDestroy
    public void close() {
        try (Connection conn = open(busyTimeout); var stmt = conn.createStatement()) {
            stmt.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            log.info("SQLiteGraphStore closed");
        } catch (SQLException e) {
            log.warn("WAL checkpoint on close failed: {}", e.getMessage());
        }
    }

    // ---- helpers ----

    private <T> T read(Function<SQLiteGraphSession, T> query) {
        try (Connection conn = open(busyTimeout)) {
            return query.apply(new SQLiteGraphSession(conn, objectMapper));
        } catch (SQLException e) {
            throw SQLiteErrors.translate("read", e);
        }
    }

    private Connection open(Duration timeout) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis())));
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource.getConnection();
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static void rollback(Connection conn) {
        try {
            execute(conn, "ROLLBACK");
        } catch (SQLException e) {
            log.warn("Rollback failed, connection will be discarded: {}", e.getMessage());
        }
    }

}
