package io.databrain.mutation;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.databrain.error.BrainException;
import io.databrain.error.ErrorKind;

import java.util.Map;

/**
 * Result of one mutation action. Exactly one of {@code result} or {@code error} is set.
 *
 * @param action    action name as requested
 * @param success   whether the action committed
 * @param result    action-specific values on success
 * @param errorKind classification on failure
 * @param error     error message on failure
 * @param retryable whether the caller may resend the same action
 * @param attempts  store attempts used, including conflict retries
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MutationOutcome(
        String action,
        boolean success,
        Map<String, Object> result,
        ErrorKind errorKind,
        String error,
        boolean retryable,
        int attempts
) {

    public static MutationOutcome success(String action, Map<String, Object> result, int attempts) {
        return new MutationOutcome(action, true, result == null ? Map.of() : result, null, null, false, attempts);
    }

    public static MutationOutcome failure(String action, BrainException e, int attempts) {
        return new MutationOutcome(action, false, null, e.kind(), e.getMessage(), e.isRetryable(), attempts);
    }
}
