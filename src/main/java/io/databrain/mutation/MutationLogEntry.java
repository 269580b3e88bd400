package io.databrain.mutation;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit record. Exactly one is appended per mutation invocation,
 * whether it succeeded or not.
 *
 * @param id          store-assigned sequence, 0 before the entry is persisted
 * @param action      action name, e.g. {@code CREATE_NODE} or {@code TEMPORAL_DECAY}
 * @param targetId    node the action was aimed at, if any
 * @param sourceId    secondary node (link source, merge loser), if any
 * @param params      raw parameters as received
 * @param reason      caller-supplied reason, if any
 * @param triggeredBy agent or system component that issued the action
 * @param sessionId   caller session, if any
 * @param success     whether the action committed
 * @param error       error message on failure
 * @param timestamp   when the entry was written
 */
public record MutationLogEntry(
        long id,
        String action,
        String targetId,
        String sourceId,
        Map<String, Object> params,
        String reason,
        String triggeredBy,
        String sessionId,
        boolean success,
        String error,
        Instant timestamp
) {
    public MutationLogEntry {
        params = params == null ? Map.of() : params;
    }

    public MutationLogEntry withId(long newId) {
        return new MutationLogEntry(newId, action, targetId, sourceId, params, reason, triggeredBy,
                sessionId, success, error, timestamp);
    }
}
