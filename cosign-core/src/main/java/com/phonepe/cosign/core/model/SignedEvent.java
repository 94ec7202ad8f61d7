package com.phonepe.cosign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One signed entry in an agent's log. Immutable once created.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SignedEvent {
    String version;

    /**
     * Agent that issued and signed this event
     */
    String agentId;

    /**
     * Epoch seconds at signing time
     */
    long timestamp;

    String nonce;

    Map<String, Object> payload;

    /**
     * Hash of the event preceding this one in the issuing agent's own log, or {@link ProtocolConstants#GENESIS}
     */
    String previousHash;

    /**
     * Base64 signature over every other field of this event
     */
    @With
    String signature;

    @JsonIgnore
    public String getEventType() {
        return payloadString(PayloadKeys.EVENT_TYPE).orElse(null);
    }

    public Optional<String> payloadString(final String key) {
        return Optional.ofNullable(payload)
                .map(data -> data.get(key))
                .map(Objects::toString);
    }
}
