package com.phonepe.cosign.core.errors;

/**
 * An event (or export) could not be durably written
 */
public class PersistenceError extends CosignError {
    public PersistenceError(final String message) {
        this(message, null);
    }

    public PersistenceError(final String message, final Throwable cause) {
        super(ErrorType.PERSISTENCE_FAILURE, cause, message);
    }
}
