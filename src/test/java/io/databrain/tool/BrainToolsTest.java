package io.databrain.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.brain.DataBrain;
import io.databrain.core.AgentContext;
import io.databrain.core.AgentResult;
import io.databrain.core.ToolRegistry;
import io.databrain.error.ValidationException;
import io.databrain.graph.Link;
import io.databrain.graph.LinkType;
import io.databrain.graph.Metadata;
import io.databrain.graph.Neighbor;
import io.databrain.graph.Node;
import io.databrain.graph.NodeCategory;
import io.databrain.graph.NodeType;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationOutcome;
import io.databrain.mutation.MutationRequest;
import io.databrain.retrieval.BrainContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class BrainToolsTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DataBrain brain;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        brain = mock(DataBrain.class);
        registry = new ToolRegistry(objectMapper);
        new BrainTools(registry, brain, objectMapper).registerTools();
    }

    private static Node node(String id, String label, double mass, String description) {
        return new Node(id, label, NodeType.KNOWLEDGE, 0, 0, 250, mass, NodeCategory.STATIC, "",
                NOW, NOW, 0, 0, description, Metadata.empty(), null, null, 1);
    }

    @Test
    void shouldRegisterBothTools() {
        assertEquals(List.of("get_brain_context", "mutate_brain"), registry.getAllToolNames());
        assertEquals(2, registry.getAllToolCallbacks().size());
    }

    @Test
    void shouldReturnContextAsJson() throws Exception {
        Node primary = node("n1", "Portfolio Optimization", 28, "Mean-variance allocation");
        Node neighbor = node("n2", "Sentiment Analysis", 20, "");
        Link link = new Link("l1", "n1", "n2", 0.8, LinkType.SEMANTIC, NOW, null, 0, 0.8, Metadata.empty());
        when(brain.getBrainContext("portfolio", 3))
                .thenReturn(new BrainContext("portfolio", primary, 1.0, List.of(new Neighbor(neighbor, link))));

        AgentResult result = registry.executeTool("get_brain_context",
                "{\"query\": \"portfolio\", \"max_neighbors\": 3}", AgentContext.of("planner", "s1"));

        assertFalse(result.error());
        JsonNode json = objectMapper.readTree(result.value());
        assertEquals("n1", json.get("primary").get("id").asText());
        assertEquals("Knowledge", json.get("primary").get("layer").asText());
        assertEquals("Mean-variance allocation", json.get("primary").get("description").asText());
        assertEquals(1, json.get("neighbors").size());
        JsonNode first = json.get("neighbors").get(0);
        assertEquals("Sentiment Analysis", first.get("label").asText());
        assertEquals(0.8, first.get("strength").asDouble());
        assertEquals("outgoing", first.get("direction").asText());
        assertFalse(first.has("description"));
    }

    @Test
    void shouldReturnEmptyContextWithNote() throws Exception {
        when(brain.getBrainContext(eq("nothing"), isNull())).thenReturn(BrainContext.empty("nothing"));

        AgentResult result = registry.executeTool("get_brain_context", "{\"query\": \"nothing\"}", new AgentContext());

        JsonNode json = objectMapper.readTree(result.value());
        assertTrue(json.get("primary").isNull());
        assertEquals(0, json.get("neighbors").size());
        assertTrue(json.has("note"));
    }

    @Test
    void shouldRejectMissingQueryAndBadNeighborCount() {
        assertTrue(registry.executeTool("get_brain_context", "{}", new AgentContext()).error());
        assertTrue(registry.executeTool("get_brain_context",
                "{\"query\": \"x\", \"max_neighbors\": \"many\"}", new AgentContext()).error());
        verifyNoInteractions(brain);
    }

    @Test
    void shouldReportBrainErrors() {
        when(brain.getBrainContext("x", -1)).thenThrow(new ValidationException("max_neighbors must not be negative: -1"));

        AgentResult result = registry.executeTool("get_brain_context",
                "{\"query\": \"x\", \"max_neighbors\": -1}", new AgentContext());

        assertTrue(result.error());
        assertTrue(result.value().contains("VALIDATION"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPassActionsAndCallerToBrain() throws Exception {
        when(brain.mutateBrain(anyList(), any())).thenReturn(List.of(
                MutationOutcome.success("CREATE_NODE", Map.of("node_id", "n_1"), 1)));

        AgentResult result = registry.executeTool("mutate_brain", """
                {"actions": [{"action": "CREATE_NODE", "params": {"label": "Alpha", "initial_mass": 30}}]}
                """, AgentContext.of("planner", "s-42"));

        ArgumentCaptor<List<MutationRequest>> requests = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<MutationContext> origin = ArgumentCaptor.forClass(MutationContext.class);
        verify(brain).mutateBrain(requests.capture(), origin.capture());
        assertEquals("CREATE_NODE", requests.getValue().get(0).action());
        assertEquals("Alpha", requests.getValue().get(0).params().get("label"));
        assertEquals("planner", origin.getValue().triggeredBy());
        assertEquals("s-42", origin.getValue().sessionId());

        JsonNode json = objectMapper.readTree(result.value());
        assertTrue(json.get(0).get("success").asBoolean());
        assertEquals("n_1", json.get(0).get("result").get("node_id").asText());
        assertFalse(json.get(0).has("error"));
    }

    @Test
    void shouldDefaultCallerToAgent() {
        when(brain.mutateBrain(anyList(), any())).thenReturn(List.of());

        registry.executeTool("mutate_brain", "{\"actions\": []}", new AgentContext());

        ArgumentCaptor<MutationContext> origin = ArgumentCaptor.forClass(MutationContext.class);
        verify(brain).mutateBrain(anyList(), origin.capture());
        assertEquals("agent", origin.getValue().triggeredBy());
    }

    @Test
    void shouldRejectNonArrayActions() {
        AgentResult result = registry.executeTool("mutate_brain", "{\"actions\": \"CREATE_NODE\"}", new AgentContext());

        assertTrue(result.error());
        verifyNoInteractions(brain);
    }
}
