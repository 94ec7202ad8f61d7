package com.phonepe.cosign.core.crypto;

import com.phonepe.cosign.core.model.AgentIdentity;

/**
 * Resolves an identity source (file path, key id etc.) to a usable identity.
 * Failures are reported as {@link com.phonepe.cosign.core.errors.ConfigurationError}.
 */
@FunctionalInterface
public interface IdentityLoader {
    AgentIdentity load(String source);
}
