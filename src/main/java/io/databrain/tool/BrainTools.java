package io.databrain.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.databrain.brain.DataBrain;
import io.databrain.core.AgentContext;
import io.databrain.core.AgentResult;
import io.databrain.core.ToolRegistry;
import io.databrain.error.BrainException;
import io.databrain.graph.Neighbor;
import io.databrain.graph.Node;
import io.databrain.mutation.MutationContext;
import io.databrain.mutation.MutationOutcome;
import io.databrain.mutation.MutationRequest;
import io.databrain.retrieval.BrainContext;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The two agent-callable brain tools: {@code get_brain_context} and {@code mutate_brain}.
 * Both answer in JSON.
 */
@Component
public class BrainTools {

    private static final Logger log = LoggerFactory.getLogger(BrainTools.class);

    static final String GET_BRAIN_CONTEXT = "get_brain_context";
    static final String MUTATE_BRAIN = "mutate_brain";

    private static final String CONTEXT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "What to look up in the shared brain"},
                "max_neighbors": {"type": "integer", "description": "How many related nodes to return (default 5)"}
              },
              "required": ["query"]
            }
            """;

    private static final String MUTATE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "actions": {
                  "type": "array",
                  "description": "Mutations to apply; each succeeds or fails on its own",
                  "items": {
                    "type": "object",
                    "properties": {
                      "action": {
                        "type": "string",
                        "enum": ["CREATE_NODE", "CREATE_LINK", "UPDATE_MASS", "DECAY_NODE", "MERGE_NODES"]
                      },
                      "params": {"type": "object"}
                    },
                    "required": ["action", "params"]
                  }
                }
              },
              "required": ["actions"]
            }
            """;

    private static final TypeReference<List<MutationRequest>> REQUEST_LIST = new TypeReference<>() {};

    private final ToolRegistry toolRegistry;
    private final DataBrain brain;
    private final ObjectMapper objectMapper;

    public BrainTools(ToolRegistry toolRegistry, DataBrain brain, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.brain = brain;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void registerTools() {
        toolRegistry.registerAgentTool(GET_BRAIN_CONTEXT,
                "Look up the node in the shared brain that best matches a query, with its strongest related nodes. "
                        + "Returns an empty context when nothing matches well enough.",
                CONTEXT_SCHEMA, this::getBrainContext);
        toolRegistry.registerAgentTool(MUTATE_BRAIN,
                "Record knowledge in the shared brain: create nodes and links, adjust or decay importance (mass), "
                        + "merge duplicates. Returns one outcome per action.",
                MUTATE_SCHEMA, this::mutateBrain);
        log.info("Registered 2 brain tools");
    }

    /**
     * Args: query (string, required), max_neighbors (int, optional)
     */
    private AgentResult getBrainContext(Map<String, Object> args, AgentContext ctx) {
        String query = stringArg(args, "query", "");
        if (query.isBlank()) {
            return AgentResult.error("'query' is required.");
        }
        Integer maxNeighbors;
        try {
            maxNeighbors = intArg(args, "max_neighbors");
        } catch (NumberFormatException e) {
            return AgentResult.error("'max_neighbors' must be an integer.");
        }

        try {
            BrainContext context = brain.getBrainContext(query, maxNeighbors);
            return AgentResult.of(toJson(contextView(context)));
        } catch (BrainException e) {
            return AgentResult.error(e.kind() + ": " + e.getMessage());
        }
    }

    /**
     * Args: actions (array of {action, params}, required)
     */
    private AgentResult mutateBrain(Map<String, Object> args, AgentContext ctx) {
        Object raw = args.get("actions");
        if (!(raw instanceof List<?>)) {
            return AgentResult.error("'actions' must be an array of {action, params}.");
        }
        List<MutationRequest> requests;
        try {
            requests = objectMapper.convertValue(raw, REQUEST_LIST);
        } catch (IllegalArgumentException e) {
            return AgentResult.error("Malformed actions: " + e.getMessage());
        }

        MutationContext origin = MutationContext.agent(ctx.agentName(), ctx.sessionId());
        List<MutationOutcome> outcomes = brain.mutateBrain(requests, origin);
        return AgentResult.of(toJson(outcomes));
    }

    private static Map<String, Object> contextView(BrainContext context) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("query", context.query());
        if (context.isEmpty()) {
            view.put("primary", null);
            view.put("neighbors", List.of());
            view.put("note", "No node matched the query closely enough.");
            return view;
        }
        Map<String, Object> primary = nodeView(context.primary());
        primary.put("score", round2(context.score()));
        view.put("primary", primary);
        view.put("neighbors", context.neighbors().stream().map(BrainTools::neighborView).toList());
        return view;
    }

    private static Map<String, Object> nodeView(Node node) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", node.id());
        view.put("label", node.label());
        view.put("type", node.type().wireName());
        view.put("layer", node.layer().displayName());
        view.put("mass", node.mass());
        if (!node.description().isBlank()) {
            view.put("description", node.description());
        }
        return view;
    }

    private static Map<String, Object> neighborView(Neighbor neighbor) {
        Map<String, Object> view = nodeView(neighbor.node());
        view.put("strength", neighbor.strength());
        view.put("link_type", neighbor.link().linkType().wireName());
        view.put("direction", neighbor.outgoing() ? "outgoing" : "incoming");
        return view;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result is not serializable", e);
        }
    }

    private static String stringArg(Map<String, Object> args, String key, String defaultValue) {
        Object val = args.get(key);
        return val != null ? val.toString() : defaultValue;
    }

    private static Integer intArg(Map<String, Object> args, String key) {
        Object val = args.get(key);
        if (val == null) return null;
        if (val instanceof Number n) return n.intValue();
        return Integer.parseInt(val.toString().trim());
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
