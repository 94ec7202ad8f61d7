package com.phonepe.cosign.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures raised by the session protocol. None of them are retried internally.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    CONFIGURATION("Invalid session configuration: %s"),
    SESSION_STATE("Invalid session state: %s"),
    AGENT_LOOKUP("Agent '%s' not in session. Available: %s"),
    CRYPTO_FAILURE("Cryptographic operation failed: %s"),
    PERSISTENCE_FAILURE("Event persistence failed: %s"),
    ;

    private final String message;
}
