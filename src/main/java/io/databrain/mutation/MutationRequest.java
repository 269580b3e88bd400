package io.databrain.mutation;

import java.util.Map;

/**
 * One entry of a {@code mutate_brain} batch.
 *
 * @param action action name, e.g. {@code CREATE_NODE}
 * @param params action parameters as received
 */
public record MutationRequest(String action, Map<String, Object> params) {

    public MutationRequest {
        params = params == null ? Map.of() : params;
    }

    public static MutationRequest of(String action, Map<String, Object> params) {
        return new MutationRequest(action, params);
    }
}
