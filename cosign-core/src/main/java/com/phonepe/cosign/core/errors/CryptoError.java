package com.phonepe.cosign.core.errors;

/**
 * Signing, verification or key handling failed
 */
public class CryptoError extends CosignError {
    public CryptoError(final String message) {
        this(message, null);
    }

    public CryptoError(final String message, final Throwable cause) {
        super(ErrorType.CRYPTO_FAILURE, cause, message);
    }
}
