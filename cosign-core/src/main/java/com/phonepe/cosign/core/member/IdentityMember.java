package com.phonepe.cosign.core.member;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.cosign.core.crypto.CryptoProvider;
import com.phonepe.cosign.core.errors.CosignError;
import com.phonepe.cosign.core.errors.PersistenceError;
import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.model.EventPayloads;
import com.phonepe.cosign.core.model.IdentityProposal;
import com.phonepe.cosign.core.model.IdentityResponse;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.core.store.EventStore;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One participant: its identity plus its own hash-chained log.
 * Every event enters the log through {@link #commit(SignedEvent)}, which persists first and only then moves the chain
 * head, so a failed write never leaves the chain head pointing at an event the store does not have.
 * Not thread safe. Callers serialize access per member.
 */
@Slf4j
public class IdentityMember {
    @Getter
    private final String name;
    private final AgentIdentity identity;
    private final CryptoProvider cryptoProvider;
    private final EventStore eventStore;
    private final List<SignedEvent> entries = new ArrayList<>();

    /**
     * Hash of the last event in this member's log, {@link ProtocolConstants#GENESIS} while the log is empty
     */
    @Getter
    private String chainHead = ProtocolConstants.GENESIS;

    public IdentityMember(@NonNull String name,
                          @NonNull AgentIdentity identity,
                          @NonNull CryptoProvider cryptoProvider,
                          @NonNull EventStore eventStore) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Agent name cannot be empty");
        this.name = name;
        this.identity = identity;
        this.cryptoProvider = cryptoProvider;
        this.eventStore = eventStore;
    }

    public String getAgentId() {
        return identity.getAgentId();
    }

    public PublicKey getPublicKey() {
        return identity.getPublicKey();
    }

    public SignedEvent stamp(String eventType, Map<String, ?> payload, String sessionId) {
        return stamp(eventType, payload, sessionId, null, null);
    }

    /**
     * Signs and appends an event to this member's log.
     *
     * @param eventType     Classification of the event
     * @param payload       Caller fields. Protocol fields override same-named caller fields.
     * @param sessionId     Session the event belongs to
     * @param peerId        Agent id of the counterparty, if any
     * @param peerSignature Signature of the counterparty's matching event, if any
     * @return The appended event
     */
    public SignedEvent stamp(@NonNull String eventType,
                             Map<String, ?> payload,
                             @NonNull String sessionId,
                             String peerId,
                             String peerSignature) {
        Preconditions.checkArgument(!eventType.isEmpty(), "Event type cannot be empty");
        final var protocolFields = new LinkedHashMap<String, Object>();
        protocolFields.put(PayloadKeys.EVENT_TYPE, eventType);
        protocolFields.put(PayloadKeys.SESSION_ID, sessionId);
        protocolFields.put(PayloadKeys.PROTOCOL_VERSION, ProtocolConstants.PROTOCOL_VERSION);
        protocolFields.put(PayloadKeys.PEER_AGENT_ID, peerId);
        protocolFields.put(PayloadKeys.PEER_SIGNATURE, peerSignature);
        return commit(cryptoProvider.signEvent(identity,
                                               EventPayloads.build(payload, protocolFields),
                                               chainHead));
    }

    public IdentityProposal proposeIdentity(List<String> capabilities, Map<String, Object> metadata) {
        return cryptoProvider.buildIdentityProposal(identity, capabilities, metadata);
    }

    public IdentityResponse respondTo(@NonNull IdentityProposal proposal, List<String> capabilities) {
        return cryptoProvider.buildIdentityResponse(identity, proposal, capabilities);
    }

    /**
     * Records this member's side of a handshake
     */
    public SignedEvent cosignHandshake(@NonNull IdentityProposal proposal,
                                       @NonNull IdentityResponse response,
                                       Map<String, Object> extensions) {
        return commit(cryptoProvider.buildCosignedEvent(identity, proposal, response, chainHead, extensions));
    }

    /**
     * @return Read only snapshot of the log
     */
    public List<SignedEvent> events() {
        return List.copyOf(entries);
    }

    public int eventCount() {
        return entries.size();
    }

    public Optional<SignedEvent> lastEvent() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public String toString() {
        return "IdentityMember(name=%s, agentId=%s, events=%d)".formatted(name, getAgentId(), entries.size());
    }

    private SignedEvent commit(final SignedEvent event) {
        final var eventHash = cryptoProvider.digestEvent(event);
        try {
            eventStore.persist(event);
        }
        catch (CosignError e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new PersistenceError("Could not store %s event for agent %s".formatted(event.getEventType(), name), e);
        }
        chainHead = eventHash;
        entries.add(event);
        log.debug("Agent {} logged {} event {}", name, event.getEventType(), eventHash);
        return event;
    }
}
