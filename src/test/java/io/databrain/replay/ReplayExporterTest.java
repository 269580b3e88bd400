package io.databrain.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.MutableClock;
import io.databrain.config.BrainProperties;
import io.databrain.error.ValidationException;
import io.databrain.graph.SQLiteGraphStore;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationEngine;
import io.databrain.mutation.MutationRequest;
import io.databrain.similarity.NGramSimilarityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplayExporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SQLiteGraphStore store;
    private MutationEngine engine;
    private ReplayExporter exporter;

    @BeforeEach
    void setUp() {
        NGramSimilarityScorer scorer = new NGramSimilarityScorer();
        store = new SQLiteGraphStore(tempDir.resolve("brain.db"), scorer);
        store.init();
        BrainProperties properties = replayProperties(0);
        engine = new MutationEngine(store, scorer, properties, MutableClock.at("2025-03-10T12:00:00Z"));
        exporter = new ReplayExporter(store, properties, objectMapper);
    }

    private BrainProperties replayProperties(int minAccessCount) {
        return new BrainProperties(null, null, null, null, null, new BrainProperties.Replay(
                true, null, 30.0, minAccessCount, 50, tempDir.resolve("replay").toString(), null));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private String create(String label, String type, double mass, String description) {
        Map<String, Object> params = new HashMap<>();
        params.put("label", label);
        params.put("type", type);
        params.put("initial_mass", mass);
        params.put("description", description);
        return (String) engine.apply(MutationRequest.of("CREATE_NODE", params), MutationContext.system("test"))
                .result().get("node_id");
    }

    private void seed() {
        String hedging = create("Hedging", "knowledge", 60, "Offsetting exposure with opposite positions.");
        String diversify = create("Diversify", "wisdom", 40, "");
        create("Raw Tick", "information", 90, "");
        create("Faint Idea", "knowledge", 10, "");
        engine.apply(MutationRequest.of("CREATE_LINK",
                Map.of("source_id", hedging, "target_id", diversify, "weight", 0.8)), MutationContext.system("test"));
    }

    @Test
    void shouldBuildExplanationAndRelationshipSamples() {
        seed();

        List<ReplaySample> samples = exporter.buildSamples("default");

        assertEquals(4, samples.size());
        ReplaySample explain = samples.get(0);
        assertEquals("Explain the concept: Hedging", explain.instruction());
        assertEquals("Offsetting exposure with opposite positions.", explain.output());
        assertEquals("Knowledge", explain.layer());
        assertEquals(0.6, explain.confidence());

        ReplaySample relate = samples.get(1);
        assertEquals("How is Hedging related to other concepts?", relate.instruction());
        assertEquals("Hedging is connected to: Diversify (semantic, 0.80).", relate.output());
        assertEquals(2, relate.sourceNodeIds().size());

        ReplaySample wisdom = samples.get(2);
        assertEquals("Wisdom", wisdom.layer());
        assertEquals("Diversify is a wisdom-level concept in the shared knowledge graph.", wisdom.output());
        assertTrue(samples.stream().allMatch(s -> s.exportBatch().equals(explain.exportBatch())));
    }

    @Test
    void shouldProduceIdenticalOutputForSameSnapshot() {
        seed();

        List<ReplaySample> first = exporter.buildSamples("default");
        List<ReplaySample> second = exporter.buildSamples("default");

        assertEquals(first, second);
        assertNotEquals(first.get(0).exportBatch(), exporter.buildSamples("qa").get(0).exportBatch());
    }

    @Test
    void shouldUseProfilePhrasing() {
        seed();

        List<ReplaySample> samples = exporter.buildSamples("qa");

        assertEquals("What is Hedging?", samples.get(0).instruction());
        assertEquals("qa", samples.get(0).profile());
    }

    @Test
    void shouldSkipRarelyAccessedNodes() {
        seed();
        String hedging = store.findBySimilarity("hedging", 1).get(0).node().id();
        for (int i = 0; i < 5; i++) {
            Instant at = Instant.parse("2025-03-10T13:00:00Z").plusSeconds(i);
            store.inTransaction(tx -> tx.recordAccess(hedging, at));
        }
        var frequentOnly = new ReplayExporter(store, replayProperties(5), objectMapper);

        List<ReplaySample> samples = frequentOnly.buildSamples("default");

        assertEquals(2, samples.size());
        assertTrue(samples.stream().allMatch(s -> s.sourceNodeIds().get(0).equals(hedging)));
    }

    @Test
    void shouldAddImplementationGuidanceForCodeLabels() {
        seed();
        create("API Gateway", "knowledge", 50, "Routes requests to services.");

        List<ReplaySample> samples = exporter.buildSamples("code");

        List<ReplaySample> guidance = samples.stream()
                .filter(s -> s.instruction().startsWith("Write implementation guidance")).toList();
        assertEquals(1, guidance.size());
        assertEquals("Write implementation guidance for API Gateway.", guidance.get(0).instruction());
        assertEquals("When implementing features related to API Gateway, consider: Routes requests to services. "
                + "Key dependencies: none identified.", guidance.get(0).output());
        assertEquals(6, samples.size());
    }

    @Test
    void shouldAddStrategicAnalysisForWisdomNodes() {
        seed();

        List<ReplaySample> samples = exporter.buildSamples("strategy");

        assertEquals(5, samples.size());
        ReplaySample strategic = samples.get(4);
        assertEquals("Give a strategic analysis of Diversify.", strategic.instruction());
        assertEquals("Strategically, Diversify stands for: Diversify is a wisdom-level concept in the shared "
                + "knowledge graph. It draws on 1 related concepts and holds 40% confidence.", strategic.output());
        assertEquals("Wisdom", strategic.layer());
        assertEquals(2, strategic.sourceNodeIds().size());
    }

    @Test
    void shouldWriteJsonlFile() throws Exception {
        seed();

        ReplayReport report = exporter.run("default");

        assertEquals(4, report.samplesWritten());
        assertTrue(report.errors().isEmpty());
        Path file = Path.of(report.file());
        assertEquals("replay-default-" + report.exportBatch() + ".jsonl", file.getFileName().toString());
        List<String> lines = Files.readAllLines(file);
        assertEquals(4, lines.size());
        JsonNode line = objectMapper.readTree(lines.get(0));
        assertEquals("Explain the concept: Hedging", line.get("instruction").asText());
        assertEquals("Knowledge", line.get("layer").asText());
        assertEquals(report.exportBatch(), line.get("export_batch").asText());
        assertTrue(line.get("source_node_ids").isArray());
    }

    @Test
    void shouldWriteNothingWhenNoNodeQualifies() {
        create("Faint Idea", "knowledge", 10, "");

        ReplayReport report = exporter.run("default");

        assertEquals(0, report.samplesWritten());
        assertNull(report.file());
        assertFalse(Files.exists(exporter.getExportDir()));
    }

    @Test
    void shouldRunEachProfileOnce() {
        seed();

        List<ReplayReport> reports = exporter.run(List.of("default", "qa", "default"));

        assertEquals(List.of("default", "qa"), reports.stream().map(ReplayReport::profile).toList());
    }

    @Test
    void shouldRejectUnsafeProfileNames() {
        assertThrows(ValidationException.class, () -> exporter.run("../etc"));
        assertThrows(ValidationException.class, () -> exporter.buildSamples(""));
    }
}
