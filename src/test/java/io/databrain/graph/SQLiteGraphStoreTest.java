package io.databrain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.config.BrainProperties;
import io.databrain.error.ConflictException;
import io.databrain.error.NotFoundException;
import io.databrain.error.StoreUnavailableException;
import io.databrain.error.ValidationException;
import io.databrain.mutation.MutationLogEntry;
import io.databrain.similarity.NGramSimilarityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteGraphStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private final NGramSimilarityScorer scorer = new NGramSimilarityScorer();
    private SQLiteGraphStore store;

    @BeforeEach
    void setUp() {
        store = new SQLiteGraphStore(tempDir.resolve("brain.db"), scorer);
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Node node(String id, String label, double mass) {
        return new Node(id, label, NodeType.INFORMATION, 0, 0, 150, mass, NodeCategory.STATIC,
                scorer.signature(label, ""), T0, T0, 0, 0, "", Metadata.empty(), null, null, 0);
    }

    private Node insert(String id, String label, double mass) {
        return store.inTransaction(tx -> tx.insertNode(node(id, label, mass)));
    }

    private Link link(String id, String source, String target, double strength) {
        return new Link(id, source, target, strength, LinkType.SEMANTIC, T0, null, 0, strength, Metadata.empty());
    }

    @Test
    void shouldInsertAndReadNodeWithAllFields() {
        var metadata = Metadata.of(Map.of("source", "email", "score", 3));
        var original = new Node("n1", "Portfolio", NodeType.KNOWLEDGE, 12.5, -3.0, 250, 42.0,
                NodeCategory.EPHEMERAL, "sig", T0, T0.plusSeconds(5), 3, 7, "desc", metadata, null, null, 0);
        store.inTransaction(tx -> tx.insertNode(original));

        Node stored = store.findNode("n1").orElseThrow();
        assertEquals("Portfolio", stored.label());
        assertEquals(NodeType.KNOWLEDGE, stored.type());
        assertEquals(12.5, stored.x());
        assertEquals(250, stored.zIndex());
        assertEquals(Layer.KNOWLEDGE, stored.layer());
        assertEquals(42.0, stored.mass());
        assertEquals(NodeCategory.EPHEMERAL, stored.category());
        assertEquals(T0, stored.createdAt());
        assertEquals(T0.plusSeconds(5), stored.lastAccessed());
        assertEquals(3, stored.accessCount());
        assertEquals(7, stored.clusterId());
        assertEquals("desc", stored.description());
        assertEquals(Optional.of("email"), stored.metadata().getString("source"));
        assertEquals(Optional.of(3.0), stored.metadata().getDouble("score"));
        assertNull(stored.lastDecayAppliedAt());
        assertEquals(1, stored.version());
    }

    @Test
    void shouldReopenExistingDatabase() {
        insert("n1", "Portfolio", 40);
        store.close();

        store = new SQLiteGraphStore(tempDir.resolve("brain.db"), scorer);
        store.init();

        assertEquals(40.0, store.findNode("n1").orElseThrow().mass());
        assertTrue(store.healthCheck());
    }

    @Test
    void shouldCreateMissingParentDirectories() {
        Path nested = tempDir.resolve("a/b/brain.db");
        var fresh = new SQLiteGraphStore(nested, scorer);
        try {
            fresh.init();
            fresh.inTransaction(tx -> tx.insertNode(node("n1", "Alpha", 20)));

            assertTrue(nested.toFile().exists());
            assertTrue(fresh.findNode("n1").isPresent());
        } finally {
            fresh.close();
        }
    }

    @Test
    void shouldReturnEmptyForUnknownNode() {
        assertTrue(store.findNode("missing").isEmpty());
        assertThrows(NotFoundException.class, () -> store.getNode("missing"));
    }

    @Test
    void shouldRejectStaleUpsert() {
        Node created = insert("n1", "Alpha", 10);

        store.inTransaction(tx -> tx.upsertNode(created.withMass(20), created.version()));

        assertThrows(ConflictException.class,
                () -> store.inTransaction(tx -> tx.upsertNode(created.withMass(30), created.version())));
        assertEquals(20.0, store.findNode("n1").orElseThrow().mass());
    }

    @Test
    void shouldInsertOnUpsertWithVersionZero() {
        Node fresh = node("n9", "Fresh", 15);

        Node stored = store.inTransaction(tx -> tx.upsertNode(fresh, 0));

        assertEquals(1, stored.version());
        assertThrows(NotFoundException.class,
                () -> store.inTransaction(tx -> tx.upsertNode(node("ghost", "Ghost", 5), 3)));
    }

    @Test
    void shouldNeverClearRedirect() {
        insert("winner", "Winner", 10);
        Node loser = insert("loser", "Loser", 10);
        Node redirected = store.inTransaction(tx -> tx.upsertNode(loser.withRedirectedTo("winner"), loser.version()));

        store.inTransaction(tx -> tx.upsertNode(redirected.withRedirectedTo(null), redirected.version()));

        assertEquals("winner", store.findNode("loser").orElseThrow().redirectedTo());
    }

    @Test
    void shouldClampMassDeltaAtomically() {
        insert("n1", "Alpha", 95);

        assertEquals(100.0, store.inTransaction(tx -> tx.applyMassDelta("n1", 20)).mass());
        assertEquals(1.0, store.inTransaction(tx -> tx.applyMassDelta("n1", -500)).mass());
        assertThrows(NotFoundException.class, () -> store.inTransaction(tx -> tx.applyMassDelta("nope", 1)));
    }

    @Test
    void shouldRejectDuplicateNodeId() {
        insert("n1", "Alpha", 10);

        assertThrows(ValidationException.class, () -> insert("n1", "Other", 20));
        assertEquals("Alpha", store.findNode("n1").orElseThrow().label());
    }

    @Test
    void shouldRejectSelfLoopAtSchemaLevel() {
        insert("n1", "Alpha", 10);

        assertThrows(ValidationException.class,
                () -> store.inTransaction(tx -> tx.insertLink(link("l1", "n1", "n1", 0.5))));
    }

    @Test
    void shouldRollBackWholeTransactionOnFailure() {
        insert("n1", "Alpha", 10);

        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            tx.applyMassDelta("n1", 30);
            throw new IllegalStateException("boom");
        }));

        assertEquals(10.0, store.findNode("n1").orElseThrow().mass());
    }

    @Test
    void shouldListNeighborsInBothDirectionsOrderedByStrength() {
        insert("a", "Alpha", 10);
        insert("b", "Beta", 50);
        insert("c", "Gamma", 30);
        insert("d", "Delta", 40);
        store.inTransaction(tx -> {
            tx.insertLink(link("l1", "a", "b", 0.4));
            tx.insertLink(link("l2", "c", "a", 0.9));
            tx.insertLink(link("l3", "a", "d", 0.4));
            return null;
        });

        List<Neighbor> neighbors = store.listNeighbors("a", 10);

        assertEquals(List.of("c", "b", "d"), neighbors.stream().map(n -> n.node().id()).toList());
        assertFalse(neighbors.get(0).outgoing());
        assertTrue(neighbors.get(1).outgoing());
        assertEquals(2, store.listNeighbors("a", 2).size());
    }

    @Test
    void shouldCollapseParallelLinksIntoOneNeighbor() {
        insert("a", "Alpha", 10);
        insert("b", "Beta", 10);
        store.inTransaction(tx -> {
            tx.insertLink(link("l1", "a", "b", 0.3));
            tx.insertLink(link("l2", "b", "a", 0.7));
            return null;
        });

        List<Neighbor> neighbors = store.listNeighbors("a", 10);

        assertEquals(1, neighbors.size());
        assertEquals(0.7, neighbors.get(0).strength());
        assertEquals("l2", neighbors.get(0).link().id());
    }

    @Test
    void shouldHideRedirectedNeighbors() {
        insert("a", "Alpha", 10);
        Node b = insert("b", "Beta", 10);
        store.inTransaction(tx -> {
            tx.insertLink(link("l1", "a", "b", 0.5));
            tx.upsertNode(b.withRedirectedTo("a"), b.version());
            return null;
        });

        assertTrue(store.listNeighbors("a", 5).isEmpty());
    }

    @Test
    void shouldFollowRedirectChainOnGetNode() {
        insert("c", "Gamma", 10);
        Node b = insert("b", "Beta", 10);
        Node a = insert("a", "Alpha", 10);
        store.inTransaction(tx -> {
            tx.upsertNode(b.withRedirectedTo("c"), b.version());
            tx.upsertNode(a.withRedirectedTo("b"), a.version());
            return null;
        });

        assertEquals("c", store.getNode("a").id());
        assertEquals("b", store.findNode("a").orElseThrow().redirectedTo());
    }

    @Test
    void shouldExcludeResultsBelowMinimumScore() {
        insert("a", "Portfolio Optimization", 10);
        insert("b", "Sentiment Analysis", 90);

        List<ScoredNode> results = store.findBySimilarity("portfolio", 5);

        assertEquals(1, results.size());
        assertEquals("a", results.get(0).node().id());
        assertEquals(1.0, results.get(0).score());
        assertTrue(store.findBySimilarity("quantum chromodynamics", 5).isEmpty());
        assertTrue(store.findBySimilarity("   ", 5).isEmpty());
    }

    @Test
    void shouldScoreLightNodesBeyondFirstPage() {
        store.close();
        var properties = new BrainProperties(
                new BrainProperties.Store(tempDir.resolve("paged.db").toString(), 0),
                new BrainProperties.Similarity(null, 2), null, null, null, null);
        store = new SQLiteGraphStore(properties, scorer, new ObjectMapper());
        store.init();
        insert("alpha", "Alpha", 90);
        insert("beta", "Beta", 80);
        insert("gamma", "Gamma", 70);
        insert("portfolio", "Portfolio Optimization", 10);

        List<ScoredNode> results = store.findBySimilarity("portfolio", 5);

        assertEquals(List.of("portfolio"), results.stream().map(s -> s.node().id()).toList());
        assertEquals(1, store.findBySimilarity("gamma", 5).size());
    }

    @Test
    void shouldBreakSimilarityTiesByMassThenRecency() {
        insert("light", "Market Risk", 10);
        insert("heavy", "Market Risk", 60);

        List<ScoredNode> results = store.findBySimilarity("market risk", 5);

        assertEquals(List.of("heavy", "light"), results.stream().map(s -> s.node().id()).toList());
    }

    @Test
    void shouldApplyTemporalDecayOncePerWindow() {
        insert("n1", "Alpha", 80);
        Instant today = T0.plus(Duration.ofDays(10)).truncatedTo(ChronoUnit.DAYS);

        Optional<Node> first = store.inTransaction(tx -> tx.applyTemporalDecay("n1", 0.5, today.plusSeconds(60), today));
        Optional<Node> second = store.inTransaction(tx -> tx.applyTemporalDecay("n1", 0.5, today.plusSeconds(120), today));

        assertEquals(40.0, first.orElseThrow().mass());
        assertTrue(second.isEmpty());
        assertEquals(40.0, store.findNode("n1").orElseThrow().mass());
    }

    @Test
    void shouldScanInactiveOldestFirstAndSkipFloor() {
        store.inTransaction(tx -> {
            tx.insertNode(new Node("old", "Old", NodeType.CONCEPT, 0, 0, 150, 10, NodeCategory.STATIC, "",
                    T0, T0.minus(Duration.ofDays(30)), 0, 0, "", Metadata.empty(), null, null, 0));
            tx.insertNode(new Node("older", "Older", NodeType.CONCEPT, 0, 0, 150, 10, NodeCategory.STATIC, "",
                    T0, T0.minus(Duration.ofDays(60)), 0, 0, "", Metadata.empty(), null, null, 0));
            tx.insertNode(new Node("floor", "Floor", NodeType.CONCEPT, 0, 0, 150, 1.0, NodeCategory.STATIC, "",
                    T0, T0.minus(Duration.ofDays(90)), 0, 0, "", Metadata.empty(), null, null, 0));
            tx.insertNode(node("fresh", "Fresh", 10));
            return null;
        });

        List<Node> inactive = store.scanInactive(T0.minus(Duration.ofDays(7)), null, 10);

        assertEquals(List.of("older", "old"), inactive.stream().map(Node::id).toList());
    }

    @Test
    void shouldPageInactiveScanFromCursor() {
        Instant stale = T0.minus(Duration.ofDays(30));
        store.inTransaction(tx -> {
            for (String id : List.of("c", "a", "b")) {
                tx.insertNode(new Node(id, id, NodeType.CONCEPT, 0, 0, 150, 60, NodeCategory.STATIC, "",
                        T0, stale, 0, 0, "", Metadata.empty(), null, null, 0));
            }
            return null;
        });
        Instant cutoff = T0.minus(Duration.ofDays(7));

        List<Node> first = store.scanInactive(cutoff, null, 2);
        List<Node> second = store.scanInactive(cutoff, first.get(1), 2);
        List<Node> third = store.scanInactive(cutoff, second.get(0), 2);

        assertEquals(List.of("a", "b"), first.stream().map(Node::id).toList());
        assertEquals(List.of("c"), second.stream().map(Node::id).toList());
        assertTrue(third.isEmpty());
    }

    @Test
    void shouldScanByMassWithinLayers() {
        store.inTransaction(tx -> {
            tx.insertNode(new Node("k", "Know", NodeType.KNOWLEDGE, 0, 0, 250, 50, NodeCategory.STATIC, "",
                    T0, T0, 0, 0, "", Metadata.empty(), null, null, 0));
            tx.insertNode(new Node("w", "Wise", NodeType.WISDOM, 0, 0, 350, 70, NodeCategory.STATIC, "",
                    T0, T0, 0, 0, "", Metadata.empty(), null, null, 0));
            tx.insertNode(node("i", "Info", 90));
            return null;
        });

        assertEquals(List.of("w", "k"), store.scanByMassDesc(30, 200, 0, 10).stream().map(Node::id).toList());
        assertEquals(List.of("w"), store.scanByMassDesc(60, 200, 0, 10).stream().map(Node::id).toList());
        store.inTransaction(tx -> tx.recordAccess("k", T0.plusSeconds(1)));
        assertEquals(List.of("k"), store.scanByMassDesc(30, 200, 1, 10).stream().map(Node::id).toList());
    }

    @Test
    void shouldAppendAndReadMutationLogInOrder() {
        store.inTransaction(tx -> {
            tx.appendLog(new MutationLogEntry(0, "CREATE_NODE", "n1", null, Map.of("label", "A"),
                    null, "agent-1", "s1", true, null, T0));
            tx.appendLog(new MutationLogEntry(0, "UPDATE_MASS", "n1", null, Map.of("delta", 5),
                    "reinforce", "agent-2", null, false, "NOT_FOUND: x", T0.plusSeconds(1)));
            return null;
        });

        List<MutationLogEntry> recent = store.recentMutations(10);
        assertEquals(2, recent.size());
        assertEquals("UPDATE_MASS", recent.get(0).action());
        assertFalse(recent.get(0).success());
        assertEquals("reinforce", recent.get(0).reason());
        assertEquals(5, ((Number) recent.get(0).params().get("delta")).intValue());
        assertTrue(recent.get(1).id() < recent.get(0).id());

        List<MutationLogEntry> history = store.mutationsForNode("n1", 10);
        assertEquals(List.of("CREATE_NODE", "UPDATE_MASS"), history.stream().map(MutationLogEntry::action).toList());
    }

    @Test
    void shouldReportStats() {
        store.inTransaction(tx -> {
            tx.insertNode(node("a", "A", 5));
            tx.insertNode(node("b", "B", 30));
            tx.insertNode(new Node("c", "C", NodeType.CONCEPT, 0, 0, 150, 1.0, NodeCategory.STATIC, "",
                    T0, T0.minus(Duration.ofDays(20)), 0, 0, "", Metadata.empty(), null, null, 0));
            return null;
        });

        GraphStats stats = store.stats(T0.minus(Duration.ofDays(7)));

        assertEquals(2, stats.activeCount());
        assertEquals(17.5, stats.avgActiveMass(), 1e-9);
        assertEquals(1, stats.inactiveCount());
        assertEquals(1, stats.nodesAtMinimum());
        assertEquals(2, stats.massUpTo10());
        assertEquals(1, stats.mass10To50());
        assertEquals(0, stats.mass50To100());
    }

    @Test
    void shouldRejectDuplicateForceField() {
        var field = new ForceField("ff1", "Finance", 10, 20, 150, 0.5, "sig", T0);
        store.inTransaction(tx -> tx.insertForceField(field));

        assertThrows(ValidationException.class, () -> store.inTransaction(tx -> tx.insertForceField(field)));
        assertEquals(List.of(field), store.listForceFields());
    }

    @Test
    void shouldNotBlockReadersWhileWriterHoldsLock() throws Exception {
        insert("n1", "Alpha", 10);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = executor.submit(() -> store.inTransaction(tx -> {
                tx.applyMassDelta("n1", 5);
                locked.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertTrue(locked.await(5, TimeUnit.SECONDS));

            // uncommitted write is invisible, and the read does not wait for it
            assertEquals(10.0, store.findNode("n1").orElseThrow().mass());
            assertThrows(StoreUnavailableException.class,
                    () -> store.inTransaction(Duration.ofMillis(50), tx -> tx.recordAccess("n1", T0)));

            release.countDown();
            writer.get(5, TimeUnit.SECONDS);
            assertEquals(15.0, store.findNode("n1").orElseThrow().mass());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldPassHealthCheck() {
        assertTrue(store.healthCheck());
        assertEquals(0, store.countNodes());
    }
}
