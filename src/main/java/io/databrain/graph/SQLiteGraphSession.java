package io.databrain.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.error.ConflictException;
import io.databrain.error.NotFoundException;
import io.databrain.error.ValidationException;
import io.databrain.mutation.MutationLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All SQL against the brain schema, bound to one JDBC connection.
 * Used both for autocommit reads and inside {@code BEGIN IMMEDIATE} transactions.
 */
class SQLiteGraphSession implements GraphTransaction {

    private static final Logger log = LoggerFactory.getLogger(SQLiteGraphSession.class);

    static final String NODE_COLUMNS = """
            n.node_id, n.label, n.type, n.x_coord, n.y_coord, n.z_index, n.mass, n.node_category,
            n.similarity_signature, n.created_at, n.last_accessed, n.access_count, n.cluster_id,
            n.description, n.metadata, n.redirected_to, n.last_decay_applied_at, n.version
            """;

    static final String LINK_COLUMNS = """
            l.link_id, l.source_node_id, l.target_node_id, l.strength, l.link_type,
            l.created_at AS link_created_at, l.last_traversed, l.traversal_count, l.weight,
            l.metadata AS link_metadata
            """;

    private static final String LOG_COLUMNS = """
            id, action, target_node_id, source_node_id, params, reason, triggered_by, session_id,
            success, error_message, created_at
            """;

    /** Strength desc, neighbor mass desc, most recent traversal first, then neighbor id. */
    static final Comparator<Neighbor> NEIGHBOR_ORDER = Comparator
            .comparingDouble(Neighbor::strength).reversed()
            .thenComparing(Comparator.comparingDouble((Neighbor nb) -> nb.node().mass()).reversed())
            .thenComparing(nb -> nb.link().lastTraversed(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(nb -> nb.node().id());

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Connection connection;
    private final ObjectMapper objectMapper;

    SQLiteGraphSession(Connection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    // ---- nodes ----

    @Override
    public Optional<Node> findNode(String id) {
        return sql("findNode", () -> {
            try (var stmt = connection.prepareStatement(
                    "SELECT " + NODE_COLUMNS + " FROM graph_nodes n WHERE n.node_id = ?")) {
                stmt.setString(1, id);
                try (var rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toNode(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public Optional<Node> findNodeByLabel(String label) {
        return sql("findNodeByLabel", () -> {
            try (var stmt = connection.prepareStatement("""
                    SELECT %s FROM graph_nodes n
                    WHERE n.label = ? AND n.redirected_to IS NULL
                    ORDER BY n.mass DESC, n.last_accessed DESC, n.node_id
                    LIMIT 1
                    """.formatted(NODE_COLUMNS))) {
                stmt.setString(1, label);
                try (var rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toNode(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public Node insertNode(Node node) {
        sql("insertNode", () -> {
            try (var stmt = connection.prepareStatement("""
                    INSERT INTO graph_nodes (
                        node_id, label, type, x_coord, y_coord, z_index, mass, node_category,
                        similarity_signature, created_at, last_accessed, access_count, cluster_id,
                        description, metadata, redirected_to, last_decay_applied_at, version
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)
                    """)) {
                stmt.setString(1, node.id());
                stmt.setString(2, node.label());
                stmt.setString(3, node.type().wireName());
                stmt.setDouble(4, node.x());
                stmt.setDouble(5, node.y());
                stmt.setInt(6, node.zIndex());
                stmt.setDouble(7, Node.clampMass(node.mass()));
                stmt.setString(8, node.category().wireName());
                stmt.setString(9, node.similaritySignature());
                setInstant(stmt, 10, node.createdAt());
                setInstant(stmt, 11, node.lastAccessed());
                stmt.setLong(12, node.accessCount());
                stmt.setInt(13, node.clusterId());
                stmt.setString(14, node.description());
                stmt.setString(15, writeJson(node.metadata().asMap()));
                stmt.setString(16, node.redirectedTo());
                setInstant(stmt, 17, node.lastDecayAppliedAt());
                return stmt.executeUpdate();
            }
        });
        return reload(node.id());
    }

    @Override
    public Node upsertNode(Node node, long expectedVersion) {
        int updated = sql("upsertNode", () -> {
            // redirected_to may be set once but never cleared; created_at is immutable
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_nodes SET
                        label = ?, type = ?, x_coord = ?, y_coord = ?, z_index = ?, mass = ?,
                        node_category = ?, similarity_signature = ?, last_accessed = ?, access_count = ?,
                        cluster_id = ?, description = ?, metadata = ?,
                        redirected_to = COALESCE(redirected_to, ?),
                        last_decay_applied_at = ?, version = version + 1
                    WHERE node_id = ? AND version = ?
                    """)) {
                stmt.setString(1, node.label());
                stmt.setString(2, node.type().wireName());
                stmt.setDouble(3, node.x());
                stmt.setDouble(4, node.y());
                stmt.setInt(5, node.zIndex());
                stmt.setDouble(6, Node.clampMass(node.mass()));
                stmt.setString(7, node.category().wireName());
                stmt.setString(8, node.similaritySignature());
                setInstant(stmt, 9, node.lastAccessed());
                stmt.setLong(10, node.accessCount());
                stmt.setInt(11, node.clusterId());
                stmt.setString(12, node.description());
                stmt.setString(13, writeJson(node.metadata().asMap()));
                stmt.setString(14, node.redirectedTo());
                setInstant(stmt, 15, node.lastDecayAppliedAt());
                stmt.setString(16, node.id());
                stmt.setLong(17, expectedVersion);
                return stmt.executeUpdate();
            }
        });
        if (updated > 0) {
            return reload(node.id());
        }
        Optional<Node> stored = findNode(node.id());
        if (stored.isPresent()) {
            throw new ConflictException("Node %s changed concurrently: expected version %d, found %d"
                    .formatted(node.id(), expectedVersion, stored.get().version()));
        }
        if (expectedVersion == 0) {
            return insertNode(node);
        }
        throw new NotFoundException("Node", node.id());
    }

    @Override
    public Node applyMassDelta(String id, double delta) {
        int updated = sql("applyMassDelta", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_nodes
                    SET mass = MIN(MAX(mass + ?, 1.0), 100.0), version = version + 1
                    WHERE node_id = ?
                    """)) {
                stmt.setDouble(1, delta);
                stmt.setString(2, id);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Node", id);
        }
        return reload(id);
    }

    @Override
    public Node recordAccess(String id, Instant at) {
        int updated = sql("recordAccess", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_nodes
                    SET access_count = access_count + 1, last_accessed = ?, version = version + 1
                    WHERE node_id = ?
                    """)) {
                setInstant(stmt, 1, at);
                stmt.setString(2, id);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Node", id);
        }
        return reload(id);
    }

    @Override
    public Optional<Node> applyTemporalDecay(String id, double factor, Instant appliedAt, Instant notDecayedSince) {
        int updated = sql("applyTemporalDecay", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_nodes
                    SET mass = MIN(MAX(mass * ?, 1.0), 100.0),
                        last_decay_applied_at = ?,
                        version = version + 1
                    WHERE node_id = ?
                      AND redirected_to IS NULL
                      AND (last_decay_applied_at IS NULL OR last_decay_applied_at < ?)
                    """)) {
                stmt.setDouble(1, factor);
                setInstant(stmt, 2, appliedAt);
                stmt.setString(3, id);
                setInstant(stmt, 4, notDecayedSince);
                return stmt.executeUpdate();
            }
        });
        return updated == 0 ? Optional.empty() : Optional.of(reload(id));
    }

    // ---- links ----

    @Override
    public Link insertLink(Link link) {
        sql("insertLink", () -> {
            try (var stmt = connection.prepareStatement("""
                    INSERT INTO graph_links (
                        link_id, source_node_id, target_node_id, strength, link_type, created_at,
                        last_traversed, traversal_count, weight, metadata
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, link.id());
                stmt.setString(2, link.sourceId());
                stmt.setString(3, link.targetId());
                stmt.setDouble(4, Link.clampStrength(link.strength()));
                stmt.setString(5, link.linkType().wireName());
                setInstant(stmt, 6, link.createdAt());
                setInstant(stmt, 7, link.lastTraversed());
                stmt.setLong(8, link.traversalCount());
                stmt.setDouble(9, link.weight());
                stmt.setString(10, writeJson(link.metadata().asMap()));
                return stmt.executeUpdate();
            }
        });
        return link;
    }

    @Override
    public Link updateLink(Link link) {
        int updated = sql("updateLink", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_links SET
                        source_node_id = ?, target_node_id = ?, strength = ?, link_type = ?,
                        last_traversed = ?, traversal_count = ?, weight = ?, metadata = ?
                    WHERE link_id = ?
                    """)) {
                stmt.setString(1, link.sourceId());
                stmt.setString(2, link.targetId());
                stmt.setDouble(3, Link.clampStrength(link.strength()));
                stmt.setString(4, link.linkType().wireName());
                setInstant(stmt, 5, link.lastTraversed());
                stmt.setLong(6, link.traversalCount());
                stmt.setDouble(7, link.weight());
                stmt.setString(8, writeJson(link.metadata().asMap()));
                stmt.setString(9, link.id());
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Link", link.id());
        }
        return link;
    }

    @Override
    public void deleteLink(String linkId) {
        sql("deleteLink", () -> {
            try (var stmt = connection.prepareStatement("DELETE FROM graph_links WHERE link_id = ?")) {
                stmt.setString(1, linkId);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<Link> findLink(String sourceId, String targetId, LinkType linkType) {
        return sql("findLink", () -> {
            try (var stmt = connection.prepareStatement("""
                    SELECT %s FROM graph_links l
                    WHERE l.source_node_id = ? AND l.target_node_id = ? AND l.link_type = ?
                    """.formatted(LINK_COLUMNS))) {
                stmt.setString(1, sourceId);
                stmt.setString(2, targetId);
                stmt.setString(3, linkType.wireName());
                try (var rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toLink(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<Link> listLinks(String nodeId) {
        return sql("listLinks", () -> {
            try (var stmt = connection.prepareStatement("""
                    SELECT %s FROM graph_links l
                    WHERE l.source_node_id = ? OR l.target_node_id = ?
                    ORDER BY l.created_at, l.link_id
                    """.formatted(LINK_COLUMNS))) {
                stmt.setString(1, nodeId);
                stmt.setString(2, nodeId);
                List<Link> links = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        links.add(toLink(rs));
                    }
                }
                return links;
            }
        });
    }

    @Override
    public void markTraversed(String linkId, Instant at) {
        sql("markTraversed", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE graph_links
                    SET traversal_count = traversal_count + 1, last_traversed = ?
                    WHERE link_id = ?
                    """)) {
                setInstant(stmt, 1, at);
                stmt.setString(2, linkId);
                return stmt.executeUpdate();
            }
        });
    }

    List<Neighbor> listNeighbors(String nodeId, int maxNeighbors) {
        List<Neighbor> candidates = sql("listNeighbors", () -> {
            try (var stmt = connection.prepareStatement("""
                    SELECT %s, %s
                    FROM graph_links l
                    JOIN graph_nodes n ON n.node_id = CASE
                        WHEN l.source_node_id = ? THEN l.target_node_id
                        ELSE l.source_node_id END
                    WHERE (l.source_node_id = ? OR l.target_node_id = ?)
                      AND n.redirected_to IS NULL
                      AND n.node_id <> ?
                    """.formatted(LINK_COLUMNS, NODE_COLUMNS))) {
                for (int i = 1; i <= 4; i++) {
                    stmt.setString(i, nodeId);
                }
                List<Neighbor> rows = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new Neighbor(toNode(rs), toLink(rs)));
                    }
                }
                return rows;
            }
        });

        // one entry per neighbor: the best-ranked link wins
        Map<String, Neighbor> best = new LinkedHashMap<>();
        for (Neighbor candidate : candidates) {
            best.merge(candidate.node().id(), candidate,
                    (a, b) -> NEIGHBOR_ORDER.compare(a, b) <= 0 ? a : b);
        }
        return best.values().stream()
                .sorted(NEIGHBOR_ORDER)
                .limit(Math.max(0, maxNeighbors))
                .toList();
    }

    // ---- scans ----

    List<Node> scanByMassDesc(double minMass, int minZIndex, long minAccessCount, int limit) {
        return nodes("scanByMassDesc", """
                SELECT %s FROM graph_nodes n
                WHERE n.redirected_to IS NULL AND n.mass >= ? AND n.z_index >= ? AND n.access_count >= ?
                ORDER BY n.mass DESC, n.access_count DESC, n.node_id
                LIMIT ?
                """.formatted(NODE_COLUMNS), stmt -> {
            stmt.setDouble(1, minMass);
            stmt.setInt(2, minZIndex);
            stmt.setLong(3, minAccessCount);
            stmt.setInt(4, limit);
        });
    }

    List<Node> scanInactive(Instant accessedBefore, Node after, int limit) {
        if (after == null) {
            return nodes("scanInactive", """
                    SELECT %s FROM graph_nodes n
                    WHERE n.redirected_to IS NULL AND n.last_accessed < ? AND n.mass > 1.0
                    ORDER BY n.last_accessed ASC, n.node_id
                    LIMIT ?
                    """.formatted(NODE_COLUMNS), stmt -> {
                setInstant(stmt, 1, accessedBefore);
                stmt.setInt(2, limit);
            });
        }
        // keyset continuation on (last_accessed, node_id)
        return nodes("scanInactive", """
                SELECT %s FROM graph_nodes n
                WHERE n.redirected_to IS NULL AND n.last_accessed < ? AND n.mass > 1.0
                  AND (n.last_accessed > ? OR (n.last_accessed = ? AND n.node_id > ?))
                ORDER BY n.last_accessed ASC, n.node_id
                LIMIT ?
                """.formatted(NODE_COLUMNS), stmt -> {
            setInstant(stmt, 1, accessedBefore);
            setInstant(stmt, 2, after.lastAccessed());
            setInstant(stmt, 3, after.lastAccessed());
            stmt.setString(4, after.id());
            stmt.setInt(5, limit);
        });
    }

    List<Node> liveNodesAfter(String afterId, int limit) {
        return nodes("liveNodesAfter", """
                SELECT %s FROM graph_nodes n
                WHERE n.redirected_to IS NULL AND n.node_id > ?
                ORDER BY n.node_id
                LIMIT ?
                """.formatted(NODE_COLUMNS), stmt -> {
            stmt.setString(1, afterId == null ? "" : afterId);
            stmt.setInt(2, limit);
        });
    }

    GraphStats stats(Instant activeSince) {
        return sql("stats", () -> {
            try (var stmt = connection.prepareStatement("""
                    SELECT
                        SUM(CASE WHEN last_accessed >= ? THEN 1 ELSE 0 END) AS active_count,
                        AVG(CASE WHEN last_accessed >= ? THEN mass END)     AS avg_active,
                        SUM(CASE WHEN last_accessed < ? THEN 1 ELSE 0 END)  AS inactive_count,
                        AVG(CASE WHEN last_accessed < ? THEN mass END)      AS avg_inactive,
                        SUM(CASE WHEN mass <= 1.0 THEN 1 ELSE 0 END)        AS at_minimum,
                        SUM(CASE WHEN mass <= 10 THEN 1 ELSE 0 END)         AS up_to_10,
                        SUM(CASE WHEN mass > 10 AND mass <= 50 THEN 1 ELSE 0 END) AS m10_50,
                        SUM(CASE WHEN mass > 50 THEN 1 ELSE 0 END)          AS m50_100
                    FROM graph_nodes
                    WHERE redirected_to IS NULL
                    """)) {
                for (int i = 1; i <= 4; i++) {
                    setInstant(stmt, i, activeSince);
                }
                try (var rs = stmt.executeQuery()) {
                    rs.next();
                    return new GraphStats(
                            rs.getLong("active_count"),
                            rs.getDouble("avg_active"),
                            rs.getLong("inactive_count"),
                            rs.getDouble("avg_inactive"),
                            rs.getLong("at_minimum"),
                            rs.getLong("up_to_10"),
                            rs.getLong("m10_50"),
                            rs.getLong("m50_100"));
                }
            }
        });
    }

    long countNodes() {
        return sql("countNodes", () -> {
            try (var stmt = connection.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM graph_nodes")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    // ---- force fields ----

    @Override
    public ForceField insertForceField(ForceField field) {
        boolean exists = sql("insertForceField", () -> {
            try (var stmt = connection.prepareStatement("SELECT 1 FROM force_fields WHERE field_id = ?")) {
                stmt.setString(1, field.id());
                try (var rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
        if (exists) {
            throw new ValidationException("Force field already exists: " + field.id());
        }
        sql("insertForceField", () -> {
            try (var stmt = connection.prepareStatement("""
                    INSERT INTO force_fields (field_id, label, x_coord, y_coord, radius, field_strength,
                                              signature, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, field.id());
                stmt.setString(2, field.label());
                stmt.setDouble(3, field.x());
                stmt.setDouble(4, field.y());
                stmt.setInt(5, field.radius());
                stmt.setDouble(6, field.strength());
                stmt.setString(7, field.signature());
                setInstant(stmt, 8, field.createdAt());
                return stmt.executeUpdate();
            }
        });
        return field;
    }

    List<ForceField> listForceFields() {
        return sql("listForceFields", () -> {
            try (var stmt = connection.createStatement();
                 var rs = stmt.executeQuery("""
                         SELECT field_id, label, x_coord, y_coord, radius, field_strength, signature, created_at
                         FROM force_fields ORDER BY field_id
                         """)) {
                List<ForceField> fields = new ArrayList<>();
                while (rs.next()) {
                    fields.add(new ForceField(
                            rs.getString("field_id"),
                            rs.getString("label"),
                            rs.getDouble("x_coord"),
                            rs.getDouble("y_coord"),
                            rs.getInt("radius"),
                            rs.getDouble("field_strength"),
                            rs.getString("signature"),
                            instant(rs, "created_at")));
                }
                return fields;
            }
        });
    }

    // ---- mutation log ----

    @Override
    public MutationLogEntry appendLog(MutationLogEntry entry) {
        long id = sql("appendLog", () -> {
            try (var stmt = connection.prepareStatement("""
                    INSERT INTO neuroplasticity_log (
                        action, target_node_id, source_node_id, params, reason, triggered_by,
                        session_id, success, error_message, created_at
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, entry.action());
                stmt.setString(2, entry.targetId());
                stmt.setString(3, entry.sourceId());
                stmt.setString(4, writeParams(entry.params()));
                stmt.setString(5, entry.reason());
                stmt.setString(6, entry.triggeredBy());
                stmt.setString(7, entry.sessionId());
                stmt.setInt(8, entry.success() ? 1 : 0);
                stmt.setString(9, entry.error());
                setInstant(stmt, 10, entry.timestamp());
                stmt.executeUpdate();
            }
            try (var stmt = connection.createStatement();
                 var rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
        return entry.withId(id);
    }

    List<MutationLogEntry> recentMutations(int limit) {
        return logEntries("recentMutations", """
                SELECT %s FROM neuroplasticity_log
                ORDER BY created_at DESC, id DESC
                LIMIT ?
                """.formatted(LOG_COLUMNS), stmt -> stmt.setInt(1, limit));
    }

    List<MutationLogEntry> mutationsForNode(String nodeId, int limit) {
        return logEntries("mutationsForNode", """
                SELECT %s FROM neuroplasticity_log
                WHERE target_node_id = ? OR source_node_id = ?
                ORDER BY created_at, id
                LIMIT ?
                """.formatted(LOG_COLUMNS), stmt -> {
            stmt.setString(1, nodeId);
            stmt.setString(2, nodeId);
            stmt.setInt(3, limit);
        });
    }

    // ---- helpers ----

    private Node reload(String id) {
        return findNode(id).orElseThrow(() -> new NotFoundException("Node", id));
    }

    private List<Node> nodes(String operation, String query, Binder binder) {
        return sql(operation, () -> {
            try (var stmt = connection.prepareStatement(query)) {
                binder.bind(stmt);
                List<Node> result = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(toNode(rs));
                    }
                }
                return result;
            }
        });
    }

    private List<MutationLogEntry> logEntries(String operation, String query, Binder binder) {
        return sql(operation, () -> {
            try (var stmt = connection.prepareStatement(query)) {
                binder.bind(stmt);
                List<MutationLogEntry> result = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(new MutationLogEntry(
                                rs.getLong("id"),
                                rs.getString("action"),
                                rs.getString("target_node_id"),
                                rs.getString("source_node_id"),
                                readMap(rs.getString("params")),
                                rs.getString("reason"),
                                rs.getString("triggered_by"),
                                rs.getString("session_id"),
                                rs.getInt("success") == 1,
                                rs.getString("error_message"),
                                instant(rs, "created_at")));
                    }
                }
                return result;
            }
        });
    }

    private Node toNode(ResultSet rs) throws SQLException {
        return new Node(
                rs.getString("node_id"),
                rs.getString("label"),
                NodeType.fromString(rs.getString("type")),
                rs.getDouble("x_coord"),
                rs.getDouble("y_coord"),
                rs.getInt("z_index"),
                rs.getDouble("mass"),
                NodeCategory.fromString(rs.getString("node_category")),
                rs.getString("similarity_signature"),
                instant(rs, "created_at"),
                instant(rs, "last_accessed"),
                rs.getLong("access_count"),
                rs.getInt("cluster_id"),
                rs.getString("description"),
                Metadata.of(readMap(rs.getString("metadata"))),
                rs.getString("redirected_to"),
                instant(rs, "last_decay_applied_at"),
                rs.getLong("version"));
    }

    private Link toLink(ResultSet rs) throws SQLException {
        return new Link(
                rs.getString("link_id"),
                rs.getString("source_node_id"),
                rs.getString("target_node_id"),
                rs.getDouble("strength"),
                LinkType.fromString(rs.getString("link_type")),
                instant(rs, "link_created_at"),
                instant(rs, "last_traversed"),
                rs.getLong("traversal_count"),
                rs.getDouble("weight"),
                Metadata.of(readMap(rs.getString("link_metadata"))));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    private String writeJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Metadata is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private String writeParams(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            log.warn("Mutation params not JSON-serializable, storing string form: {}", e.getOriginalMessage());
            return "{\"raw\":" + objectMapper.valueToTree(String.valueOf(params)) + "}";
        }
    }

    private Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column, treating as empty: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static <T> T sql(String operation, SqlCall<T> call) {
        try {
            return call.call();
        } catch (SQLException e) {
            throw SQLiteErrors.translate(operation, e);
        }
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }
}
