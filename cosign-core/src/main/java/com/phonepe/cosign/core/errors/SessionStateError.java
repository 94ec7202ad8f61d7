package com.phonepe.cosign.core.errors;

/**
 * An operation was invoked in a session state that does not allow it
 */
public class SessionStateError extends CosignError {
    public SessionStateError(final String message) {
        super(ErrorType.SESSION_STATE, null, message);
    }
}
