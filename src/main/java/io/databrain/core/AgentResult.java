package io.databrain.core;

/**
 * The result of a brain tool invocation, handed back to the calling agent.
 *
 * @param value JSON or text payload for the agent
 * @param error whether the call failed before reaching the brain
 */
public record AgentResult(String value, boolean error) {

    public static AgentResult of(String value) {
        return new AgentResult(value, false);
    }

    public static AgentResult error(String message) {
        return new AgentResult("Error: " + message, true);
    }
}
