package com.phonepe.cosign.core.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Long term identity of an agent. The private key never leaves the owning member and is never printed.
 */
@Value
public class AgentIdentity {
    @NonNull
    String agentId;

    @NonNull
    PublicKey publicKey;

    @NonNull
    @ToString.Exclude
    PrivateKey privateKey;
}
