package io.databrain.error;

/**
 * Optimistic-concurrency check failed: the stored version moved since it was read.
 */
public class ConflictException extends BrainException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
