package io.databrain.channel;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.databrain.brain.DataBrain;
import io.databrain.decay.DecayReport;
import io.databrain.decay.DecayStatus;
import io.databrain.graph.ForceField;
import io.databrain.graph.Link;
import io.databrain.graph.Node;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationLogEntry;
import io.databrain.mutation.MutationOutcome;
import io.databrain.mutation.MutationRequest;
import io.databrain.replay.ReplayReport;
import io.databrain.retrieval.BrainContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API over the brain for collaborators that are not agents (job workers, dashboards).
 */
@RestController
@RequestMapping("/api")
public class BrainController {

    private final DataBrain brain;

    public BrainController(DataBrain brain) {
        this.brain = brain;
    }

    @GetMapping("/brain/context")
    public ResponseEntity<BrainContext> context(
            @RequestParam("query") String query,
            @RequestParam(value = "max_neighbors", required = false) Integer maxNeighbors) {
        return ResponseEntity.ok(brain.getBrainContext(query, maxNeighbors));
    }

    /**
     * Applies a batch of mutations. Always 200: each action reports its own outcome.
     */
    @PostMapping("/brain/mutations")
    public ResponseEntity<List<MutationOutcome>> mutate(@RequestBody MutationBatch batch) {
        if (batch.actions() == null || batch.actions().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        var origin = new MutationContext(batch.triggeredBy(), batch.sessionId());
        return ResponseEntity.ok(brain.mutateBrain(batch.actions(), origin));
    }

    @GetMapping("/brain/nodes/{id}")
    public ResponseEntity<Node> node(@PathVariable String id) {
        return ResponseEntity.ok(brain.getNode(id));
    }

    @GetMapping("/brain/nodes/{id}/links")
    public ResponseEntity<List<Link>> links(@PathVariable String id) {
        return ResponseEntity.ok(brain.getLinks(id));
    }

    /**
     * Mutation log, newest first; with {@code node_id}, that node's history in order.
     */
    @GetMapping("/brain/log")
    public ResponseEntity<List<MutationLogEntry>> log(
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "node_id", required = false) String nodeId) {
        if (nodeId != null && !nodeId.isBlank()) {
            return ResponseEntity.ok(brain.mutationsForNode(nodeId, limit));
        }
        return ResponseEntity.ok(brain.recentMutations(limit));
    }

    @GetMapping("/brain/force-fields")
    public ResponseEntity<List<ForceField>> forceFields() {
        return ResponseEntity.ok(brain.forceFields());
    }

    @PostMapping("/brain/force-fields")
    public ResponseEntity<MutationOutcome> defineForceField(@RequestBody Map<String, Object> params) {
        MutationOutcome outcome = brain.defineForceField(params, MutationContext.system("rest"));
        return outcome.success()
                ? ResponseEntity.status(HttpStatus.CREATED).body(outcome)
                : ResponseEntity.badRequest().body(outcome);
    }

    @PostMapping("/brain/decay/run")
    public ResponseEntity<DecayReport> runDecay() {
        return ResponseEntity.ok(brain.runDecay());
    }

    @GetMapping("/brain/decay/status")
    public ResponseEntity<DecayStatus> decayStatus() {
        return ResponseEntity.ok(brain.decayStatus());
    }

    @PostMapping("/brain/replay/{profile}")
    public ResponseEntity<ReplayReport> replay(@PathVariable String profile) {
        return ResponseEntity.ok(brain.exportReplay(profile));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        if (!brain.isHealthy()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "DOWN"));
        }
        return ResponseEntity.ok(Map.of("status", "UP", "nodes", brain.nodeCount()));
    }

    public record MutationBatch(
            @JsonProperty("actions") List<MutationRequest> actions,
            @JsonProperty("triggered_by") String triggeredBy,
            @JsonProperty("session_id") String sessionId
    ) {}
}
