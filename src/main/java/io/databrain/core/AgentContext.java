package io.databrain.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Context variables of the agent calling a tool. The brain reads the agent name and session id
 * from here to attribute mutations in the log.
 */
public class AgentContext {

    public static final String AGENT_NAME = "agent_name";
    public static final String SESSION_ID = "session_id";

    private final Map<String, String> variables;

    public AgentContext() {
        this.variables = new HashMap<>();
    }

    public static AgentContext of(String agentName, String sessionId) {
        AgentContext context = new AgentContext();
        if (agentName != null) context.set(AGENT_NAME, agentName);
        if (sessionId != null) context.set(SESSION_ID, sessionId);
        return context;
    }

    public String get(String key, String defaultValue) {
        return variables.getOrDefault(key, defaultValue);
    }

    public void set(String key, String value) {
        variables.put(key, value);
    }

    public String agentName() {
        return get(AGENT_NAME, null);
    }

    public String sessionId() {
        return get(SESSION_ID, null);
    }
}
