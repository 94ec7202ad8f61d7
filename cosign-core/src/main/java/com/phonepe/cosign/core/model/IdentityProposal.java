package com.phonepe.cosign.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * First message of a handshake: the initiator's signed statement of who it is and what it can do
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IdentityProposal {
    String version;
    String agentId;

    /**
     * Base64 raw public key
     */
    String publicKey;

    List<String> capabilities;

    /**
     * Binds the proposal to a session and the proposer's session-scoped name
     */
    Map<String, Object> metadata;

    long timestamp;
    String nonce;

    @With
    String signature;
}
