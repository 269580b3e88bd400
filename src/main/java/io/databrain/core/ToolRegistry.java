package io.databrain.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of the tools agents use to reach the brain.
 *
 * <p>Each tool is registered with a description and a JSON schema and is exposed as a Spring AI
 * {@link ToolCallback}, so any LLM runtime built on Spring AI can discover and invoke it.
 * Runtimes that carry their own context variables call {@link #executeTool} directly.</p>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AgentTool> agentTools = new TreeMap<>();
    private final Map<String, ToolCallback> toolCallbacks = new TreeMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a tool with description and JSON schema, making it visible to the LLM.
     *
     * @param name        tool name
     * @param description human-readable description for the LLM
     * @param inputSchema JSON Schema string for the tool's parameters
     * @param tool        the tool implementation
     */
    public synchronized void registerAgentTool(String name, String description, String inputSchema, AgentTool tool) {
        agentTools.put(name, tool);
        toolCallbacks.put(name, new AgentToolCallback(name, description, inputSchema, this));
        log.debug("Registered agent tool: {}", name);
    }

    /**
     * Returns callbacks for the given tool names; unknown names are logged and skipped.
     */
    public synchronized List<ToolCallback> getToolCallbacks(List<String> toolNames) {
        List<ToolCallback> callbacks = new ArrayList<>();
        for (String name : toolNames) {
            ToolCallback cb = toolCallbacks.get(name);
            if (cb != null) {
                callbacks.add(cb);
            } else {
                log.warn("Tool '{}' not found in registry", name);
            }
        }
        return callbacks;
    }

    public synchronized List<ToolCallback> getAllToolCallbacks() {
        return List.copyOf(toolCallbacks.values());
    }

    public synchronized List<String> getAllToolNames() {
        return List.copyOf(agentTools.keySet());
    }

    /**
     * Executes a tool by name.
     *
     * @param toolName  the tool to execute
     * @param arguments JSON string of arguments
     * @param context   the calling agent's context
     * @return the tool result; failures are reported as error results, never thrown
     */
    public AgentResult executeTool(String toolName, String arguments, AgentContext context) {
        AgentTool tool;
        synchronized (this) {
            tool = agentTools.get(toolName);
        }
        if (tool == null) {
            log.error("Tool '{}' not found", toolName);
            return AgentResult.error("Tool '" + toolName + "' not found.");
        }
        Map<String, Object> args;
        try {
            args = parseArguments(arguments);
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed arguments for tool '{}': {}", toolName, e.getOriginalMessage());
            return AgentResult.error("Arguments are not a JSON object: " + e.getOriginalMessage());
        }
        try {
            return tool.execute(args, context == null ? new AgentContext() : context);
        } catch (RuntimeException e) {
            log.error("Error executing agent tool '{}': {}", toolName, e.getMessage(), e);
            return AgentResult.error(e.getMessage());
        }
    }

    Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(arguments, new TypeReference<>() {});
    }

    /**
     * A tool implementation with parsed arguments and access to the caller's context.
     */
    @FunctionalInterface
    public interface AgentTool {
        AgentResult execute(Map<String, Object> arguments, AgentContext context);
    }

    /**
     * Wraps an AgentTool as a Spring AI ToolCallback so the LLM can discover and invoke it.
     */
    static class AgentToolCallback implements ToolCallback {

        private final String name;
        private final String description;
        private final String inputSchema;
        private final ToolRegistry registry;

        AgentToolCallback(String name, String description, String inputSchema, ToolRegistry registry) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
            this.registry = registry;
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build();
        }

        @Override
        public String call(String toolInput) {
            return registry.executeTool(name, toolInput, new AgentContext()).value();
        }
    }
}
