package com.phonepe.cosign.core.errors;

import lombok.Getter;

/**
 * Base for all errors raised by the co-signed session protocol. All of these are fatal to the call that raised them.
 */
@Getter
public abstract class CosignError extends RuntimeException {
    private final ErrorType errorType;

    protected CosignError(ErrorType errorType, Throwable cause, Object... args) {
        super(String.format(errorType.getMessage(), args), cause);
        this.errorType = errorType;
    }
}
