package io.databrain.error;

/**
 * Classification of brain failures as reported to callers.
 */
public enum ErrorKind {
    VALIDATION(false),
    NOT_FOUND(false),
    CONFLICT(true),
    STORE_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the caller may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
