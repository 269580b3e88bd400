package io.databrain.error;

/**
 * Malformed parameters, self-loops, or a mutation aimed at a merged-away node.
 * Raised before any state change.
 */
public class ValidationException extends BrainException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
