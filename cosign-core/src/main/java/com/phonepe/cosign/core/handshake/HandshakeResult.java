package com.phonepe.cosign.core.handshake;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Record of one completed pairwise handshake. Agent "a" is the initiator.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class HandshakeResult {
    String agentA;
    String agentB;

    @JsonProperty("agent_a_id")
    String agentAId;

    @JsonProperty("agent_b_id")
    String agentBId;

    String sessionId;

    /**
     * Hash of the handshake event in the initiator's log
     */
    @JsonProperty("event_a_hash")
    String eventAHash;

    /**
     * Hash of the handshake event in the responder's log
     */
    @JsonProperty("event_b_hash")
    String eventBHash;

    /**
     * Completion time, epoch seconds
     */
    long timestamp;
}
