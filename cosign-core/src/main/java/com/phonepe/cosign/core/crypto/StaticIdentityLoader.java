package com.phonepe.cosign.core.crypto;

import com.phonepe.cosign.core.errors.ConfigurationError;
import com.phonepe.cosign.core.model.AgentIdentity;
import lombok.NonNull;

import java.util.Map;
import java.util.Optional;

/**
 * Serves identities that are already in memory, keyed by source name
 */
public class StaticIdentityLoader implements IdentityLoader {
    private final Map<String, AgentIdentity> identities;

    public StaticIdentityLoader(@NonNull Map<String, AgentIdentity> identities) {
        this.identities = Map.copyOf(identities);
    }

    @Override
    public AgentIdentity load(String source) {
        return Optional.ofNullable(source)
                .map(identities::get)
                .orElseThrow(() -> new ConfigurationError("No identity registered for source: " + source));
    }
}
