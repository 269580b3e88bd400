package io.databrain.error;

/**
 * Base type for every classified failure raised by the brain.
 * Subclasses map one-to-one onto {@link ErrorKind}.
 */
public abstract class BrainException extends RuntimeException {

    protected BrainException(String message) {
        super(message);
    }

    protected BrainException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public boolean isRetryable() {
        return kind().isRetryable();
    }
}
