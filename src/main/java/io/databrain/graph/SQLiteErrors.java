package io.databrain.graph;

import io.databrain.error.BrainException;
import io.databrain.error.StoreUnavailableException;
import io.databrain.error.ValidationException;

import java.sql.SQLException;

/**
 * Maps SQLite failures onto the brain's error kinds.
 */
final class SQLiteErrors {

    private static final int SQLITE_CONSTRAINT = 19;

    private SQLiteErrors() {
    }

    static BrainException translate(String operation, SQLException e) {
        // extended result codes carry the primary code in the low byte
        int primary = e.getErrorCode() & 0xff;
        if (primary == SQLITE_CONSTRAINT) {
            return new ValidationException("Constraint violated during %s: %s".formatted(operation, e.getMessage()), e);
        }
        return new StoreUnavailableException("Store failure during %s: %s".formatted(operation, e.getMessage()), e);
    }
}
