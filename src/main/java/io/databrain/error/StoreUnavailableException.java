package io.databrain.error;

/**
 * The backing store is unreachable, locked past its timeout, or failed mid-transaction.
 * The transaction that raised it has been rolled back.
 */
public class StoreUnavailableException extends BrainException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORE_UNAVAILABLE;
    }
}
