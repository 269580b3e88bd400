package io.databrain.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.MutableClock;
import io.databrain.config.BrainProperties;
import io.databrain.error.ValidationException;
import io.databrain.graph.Node;
import io.databrain.graph.SQLiteGraphStore;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationEngine;
import io.databrain.mutation.MutationOutcome;
import io.databrain.mutation.MutationRequest;
import io.databrain.similarity.NGramSimilarityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextRetrieverTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.at("2025-03-10T12:00:00Z");
    private SQLiteGraphStore store;
    private MutationEngine engine;
    private ContextRetriever retriever;

    @BeforeEach
    void setUp() {
        NGramSimilarityScorer scorer = new NGramSimilarityScorer();
        store = new SQLiteGraphStore(tempDir.resolve("brain.db"), scorer);
        store.init();
        BrainProperties properties = BrainProperties.defaults();
        engine = new MutationEngine(store, scorer, properties, clock);
        retriever = new ContextRetriever(store, engine, properties);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private String create(String label, double mass) {
        MutationOutcome outcome = engine.apply(
                MutationRequest.of("CREATE_NODE", Map.of("label", label, "initial_mass", mass)),
                MutationContext.system("test"));
        return (String) outcome.result().get("node_id");
    }

    private void link(String source, String target, double weight) {
        engine.apply(MutationRequest.of("CREATE_LINK",
                Map.of("source_id", source, "target_id", target, "weight", weight)), MutationContext.system("test"));
    }

    @Test
    void shouldFindLightNodeOutsideFirstScoringPage() {
        store.close();
        NGramSimilarityScorer scorer = new NGramSimilarityScorer();
        BrainProperties properties = new BrainProperties(
                new BrainProperties.Store(tempDir.resolve("paged.db").toString(), 0),
                new BrainProperties.Similarity(null, 2), null, null, null, null);
        store = new SQLiteGraphStore(properties, scorer, new ObjectMapper());
        store.init();
        engine = new MutationEngine(store, scorer, properties, clock);
        retriever = new ContextRetriever(store, engine, properties);
        create("Alpha", 90);
        create("Beta", 80);
        String portfolio = create("Portfolio Optimization", 10);

        BrainContext context = retriever.getBrainContext("portfolio", 5);

        assertFalse(context.isEmpty());
        assertEquals(portfolio, context.primary().id());
    }

    @Test
    void shouldReturnBestMatchWithRankedNeighbors() {
        String portfolio = create("Portfolio Optimization", 25);
        String sentiment = create("Sentiment Analysis", 10);
        String risk = create("Risk Budget", 40);
        link(portfolio, sentiment, 0.8);
        link(risk, portfolio, 0.3);

        BrainContext context = retriever.getBrainContext("portfolio", null);

        assertFalse(context.isEmpty());
        assertEquals(portfolio, context.primary().id());
        assertEquals(1.0, context.score());
        assertEquals(2, context.neighbors().size());
        assertEquals(sentiment, context.neighbors().get(0).node().id());
        assertEquals(0.8, context.neighbors().get(0).strength());
        assertEquals(risk, context.neighbors().get(1).node().id());
    }

    @Test
    void shouldReturnEmptyContextBelowMinimumScore() {
        create("Portfolio Optimization", 25);

        BrainContext context = retriever.getBrainContext("quantum chromodynamics", 5);

        assertTrue(context.isEmpty());
        assertNull(context.primary());
        assertTrue(context.neighbors().isEmpty());
    }

    @Test
    void shouldReturnEmptyContextForBlankQueryOrEmptyGraph() {
        assertTrue(retriever.getBrainContext("   ", null).isEmpty());
        assertTrue(retriever.getBrainContext("portfolio", null).isEmpty());
    }

    @Test
    void shouldCapNeighbors() {
        String hub = create("Hub Node", 50);
        for (int i = 0; i < 4; i++) {
            link(hub, create("Spoke " + i, 10), 0.1 * (i + 1));
        }

        assertEquals(2, retriever.getBrainContext("hub", 2).neighbors().size());
        assertEquals(0, retriever.getBrainContext("hub", 0).neighbors().size());
        assertEquals(4, retriever.getBrainContext("hub", 500).neighbors().size());
        assertThrows(ValidationException.class, () -> retriever.getBrainContext("hub", -1));
    }

    @Test
    void shouldBumpAccessOfPrimaryAndTraversedLinks() {
        String portfolio = create("Portfolio Optimization", 25);
        String sentiment = create("Sentiment Analysis", 10);
        link(portfolio, sentiment, 0.8);
        int logged = store.recentMutations(100).size();
        clock.advance(Duration.ofHours(2));

        retriever.getBrainContext("portfolio", null);

        Node primary = store.findNode(portfolio).orElseThrow();
        assertEquals(1, primary.accessCount());
        assertEquals(clock.instant(), primary.lastAccessed());
        assertEquals(1, store.listLinks(portfolio).get(0).traversalCount());
        assertEquals(0, store.findNode(sentiment).orElseThrow().accessCount());
        assertEquals(logged, store.recentMutations(100).size());
    }

    @Test
    void shouldNotReturnMergedNodes() {
        String winner = create("Market Risk", 20);
        String loser = create("Market Risk", 60);
        engine.apply(MutationRequest.of("MERGE_NODES", Map.of("winner_id", winner, "loser_id", loser)),
                MutationContext.system("test"));

        BrainContext context = retriever.getBrainContext("market risk", null);

        assertEquals(winner, context.primary().id());
    }
}
