package io.databrain.mutation;

/**
 * Who issued a mutation. Copied into every log entry.
 */
public record MutationContext(String triggeredBy, String sessionId) {

    public MutationContext {
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = "agent";
        }
    }

    public static MutationContext agent(String agentName, String sessionId) {
        return new MutationContext(agentName, sessionId);
    }

    public static MutationContext system(String component) {
        return new MutationContext(component, null);
    }
}
