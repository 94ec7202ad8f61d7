package com.phonepe.cosign.core.errors;

/**
 * Session could not be assembled from the provided agent definitions or identities
 */
public class ConfigurationError extends CosignError {
    public ConfigurationError(final String message) {
        this(message, null);
    }

    public ConfigurationError(final String message, final Throwable cause) {
        super(ErrorType.CONFIGURATION, cause, message);
    }
}
