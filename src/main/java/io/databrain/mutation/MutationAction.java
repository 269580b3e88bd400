package io.databrain.mutation;

import io.databrain.error.ValidationException;

import java.util.Locale;

/**
 * The mutation vocabulary. Only agent-callable actions are accepted from {@code mutate_brain};
 * the rest are issued by the engine's own collaborators and appear in the log under their names.
 */
public enum MutationAction {
    CREATE_NODE(true),
    CREATE_LINK(true),
    UPDATE_MASS(true),
    DECAY_NODE(true),
    MERGE_NODES(true),
    TEMPORAL_DECAY(false),
    DEFINE_FORCE_FIELD(false);

    private final boolean agentCallable;

    MutationAction(boolean agentCallable) {
        this.agentCallable = agentCallable;
    }

    /**
     * Parses an action name sent by an agent.
     *
     * @throws ValidationException when the name is missing, unknown or internal
     */
    public static MutationAction fromAgentName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Missing action");
        }
        MutationAction action;
        try {
            action = valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown action: " + name);
        }
        if (!action.agentCallable) {
            throw new ValidationException("Action not available to agents: " + name);
        }
        return action;
    }
}
