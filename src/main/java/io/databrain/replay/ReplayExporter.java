package io.databrain.replay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.config.BrainProperties;
import io.databrain.error.BrainException;
import io.databrain.error.ValidationException;
import io.databrain.graph.GraphStore;
import io.databrain.graph.Layer;
import io.databrain.graph.Neighbor;
import io.databrain.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Exports heavy, frequently used knowledge and wisdom nodes as instruction/response samples.
 *
 * <p>Per node an explanation sample is emitted, plus a relationship sample when the node has live
 * neighbors. The {@code code} profile adds implementation guidance for code-related labels and the
 * {@code strategy} profile adds a strategic analysis of wisdom nodes. Output depends only on the graph snapshot and the profile: nodes are visited in
 * (mass desc, access count desc, id) order and the batch id is a hash of the content, so the same
 * snapshot always produces the same file.</p>
 */
@Service
public class ReplayExporter {

    private static final Logger log = LoggerFactory.getLogger(ReplayExporter.class);
    private static final Pattern PROFILE_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final int RELATED_PER_NODE = 5;
    private static final int BATCH_ID_LENGTH = 16;

    private final GraphStore store;
    private final ObjectMapper objectMapper;
    private final double massThreshold;
    private final long minAccessCount;
    private final int maxNodes;
    private final Path exportDir;

    public ReplayExporter(GraphStore store, BrainProperties properties, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.massThreshold = properties.replay().massThreshold();
        this.minAccessCount = properties.replay().minAccessCount();
        this.maxNodes = properties.replay().maxNodes();
        this.exportDir = Path.of(properties.replay().exportDir());
    }

    /**
     * Exports every profile once, in the order given, skipping duplicates.
     */
    public List<ReplayReport> run(List<String> profiles) {
        List<ReplayReport> reports = new ArrayList<>();
        for (String profile : new LinkedHashSet<>(profiles)) {
            reports.add(run(profile));
        }
        return reports;
    }

    public ReplayReport run(String profile) {
        requireValidProfile(profile);
        List<ReplaySample> samples;
        try {
            samples = buildSamples(profile);
        } catch (BrainException e) {
            log.error("Replay export for profile '{}' could not read the graph", profile, e);
            return new ReplayReport(profile, 0, List.of(e.getMessage()), null, null);
        }
        if (samples.isEmpty()) {
            log.info("Replay export '{}': no nodes above mass {}", profile, massThreshold);
            return new ReplayReport(profile, 0, List.of(), null, null);
        }

        String batch = samples.get(0).exportBatch();
        Path file = exportDir.resolve("replay-%s-%s.jsonl".formatted(profile, batch));
        try {
            Files.createDirectories(exportDir);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (ReplaySample sample : samples) {
                    writer.write(objectMapper.writeValueAsString(sample));
                    writer.write('\n');
                }
            }
        } catch (IOException e) {
            log.error("Failed to write replay export {}", file, e);
            return new ReplayReport(profile, 0, List.of("write failed: " + e.getMessage()), null, batch);
        }

        log.info("Replay export '{}': {} samples written to {}", profile, samples.size(), file);
        return new ReplayReport(profile, samples.size(), List.of(), file.toString(), batch);
    }

    /**
     * Builds the samples for {@code profile} without writing anything.
     */
    public List<ReplaySample> buildSamples(String profile) {
        requireValidProfile(profile);
        ReplayPhrasing phrasing = ReplayPhrasing.forProfile(profile);
        List<Node> nodes = store.scanByMassDesc(massThreshold, 200, minAccessCount, maxNodes);

        List<ReplaySample> samples = new ArrayList<>();
        for (Node node : nodes) {
            Layer layer = node.layer();
            if (!layer.isConsolidated()) continue;
            // mass / 100, two decimals
            double confidence = Math.round(node.mass()) / 100.0;
            List<Neighbor> neighbors = store.listNeighbors(node.id(), RELATED_PER_NODE);
            List<String> sourceIds = new ArrayList<>();
            sourceIds.add(node.id());
            neighbors.forEach(n -> sourceIds.add(n.node().id()));

            samples.add(new ReplaySample(
                    phrasing.explainInstruction(node.label()),
                    "",
                    explanation(node),
                    List.of(node.id()),
                    layer.displayName(),
                    confidence,
                    profile,
                    null));

            if (!neighbors.isEmpty()) {
                String related = neighbors.stream()
                        .map(n -> String.format(Locale.ROOT, "%s (%s, %.2f)",
                                n.node().label(), n.link().linkType().wireName(), n.strength()))
                        .collect(Collectors.joining(", "));
                samples.add(new ReplaySample(
                        phrasing.relateInstruction(node.label()),
                        node.description(),
                        phrasing.relateOutput(node.label(), related),
                        sourceIds,
                        layer.displayName(),
                        confidence,
                        profile,
                        null));
            }

            if (phrasing.wantsCodeGuidance(node.label())) {
                String dependencies = neighbors.isEmpty() ? "none identified" : neighbors.stream()
                        .map(n -> n.node().label())
                        .collect(Collectors.joining(", "));
                samples.add(new ReplaySample(
                        "Write implementation guidance for %s.".formatted(node.label()),
                        "Focus on code-level recommendations.",
                        "When implementing features related to %s, consider: %s. Key dependencies: %s."
                                .formatted(node.label(), withoutPeriod(explanation(node)), dependencies),
                        sourceIds,
                        layer.displayName(),
                        confidence,
                        profile,
                        null));
            }

            if (phrasing.wantsStrategicAnalysis() && layer == Layer.WISDOM) {
                samples.add(new ReplaySample(
                        "Give a strategic analysis of %s.".formatted(node.label()),
                        "Frame it as an executive-level insight.",
                        "Strategically, %s stands for: %s. It draws on %d related concepts and holds %d%% confidence."
                                .formatted(node.label(), withoutPeriod(explanation(node)), neighbors.size(),
                                        Math.round(confidence * 100)),
                        sourceIds,
                        layer.displayName(),
                        confidence,
                        profile,
                        null));
            }
        }

        String batch = batchId(profile, samples);
        return samples.stream().map(s -> s.withExportBatch(batch)).toList();
    }

    private static String explanation(Node node) {
        if (!node.description().isBlank()) {
            return node.description();
        }
        return "%s is a %s-level concept in the shared knowledge graph."
                .formatted(node.label(), node.layer().displayName().toLowerCase(Locale.ROOT));
    }

    private static String withoutPeriod(String text) {
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }

    private String batchId(String profile, List<ReplaySample> samples) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(profile.getBytes(StandardCharsets.UTF_8));
            for (ReplaySample sample : samples) {
                digest.update((byte) '\n');
                digest.update(objectMapper.writeValueAsBytes(sample));
            }
            return HexFormat.of().formatHex(digest.digest()).substring(0, BATCH_ID_LENGTH);
        } catch (NoSuchAlgorithmException | JsonProcessingException e) {
            throw new IllegalStateException("Cannot compute replay batch id", e);
        }
    }

    private static void requireValidProfile(String profile) {
        if (profile == null || !PROFILE_NAME.matcher(profile).matches()) {
            throw new ValidationException("Invalid replay profile: " + profile);
        }
    }

    public Path getExportDir() {
        return exportDir;
    }
}
