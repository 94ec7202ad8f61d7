package com.phonepe.cosign.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Second message of a handshake: the responder's signed identity, bound to the exact proposal it answers
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IdentityResponse {
    String version;
    String agentId;
    String publicKey;
    List<String> capabilities;

    /**
     * Agent id of the proposer being answered
     */
    String proposerAgentId;

    /**
     * Hash of the full signed proposal
     */
    String proposalHash;

    long timestamp;
    String nonce;

    @With
    String signature;
}
