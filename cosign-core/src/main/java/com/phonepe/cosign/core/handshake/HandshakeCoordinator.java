package com.phonepe.cosign.core.handshake;

import com.google.common.base.Preconditions;
import com.phonepe.cosign.core.crypto.CryptoProvider;
import com.phonepe.cosign.core.errors.CryptoError;
import com.phonepe.cosign.core.member.IdentityMember;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Runs the mutual identity handshake between two members:
 * <ol>
 *     <li>initiator builds a signed identity proposal bound to the session</li>
 *     <li>responder checks it and answers with a signed identity response bound to that proposal</li>
 *     <li>initiator checks the response and co-signs the pair into its own log</li>
 *     <li>responder co-signs the same pair into its own log</li>
 * </ol>
 * Any failure aborts the pair immediately. Nothing is retried and nothing already written is rolled back.
 */
@Slf4j
public class HandshakeCoordinator {
    private final CryptoProvider cryptoProvider;
    private final List<String> capabilities;
    private final Clock clock;

    public HandshakeCoordinator(@NonNull CryptoProvider cryptoProvider) {
        this(cryptoProvider, ProtocolConstants.CAPABILITIES, Clock.systemUTC());
    }

    public HandshakeCoordinator(@NonNull CryptoProvider cryptoProvider,
                                @NonNull List<String> capabilities,
                                @NonNull Clock clock) {
        this.cryptoProvider = cryptoProvider;
        this.capabilities = List.copyOf(capabilities);
        this.clock = clock;
    }

    public HandshakeResult handshake(@NonNull IdentityMember initiator,
                                     @NonNull IdentityMember responder,
                                     @NonNull String sessionId) {
        Preconditions.checkArgument(initiator != responder, "An agent cannot handshake with itself");

        final var proposal = initiator.proposeIdentity(capabilities,
                                                       Map.of(PayloadKeys.SESSION_ID, sessionId,
                                                              PayloadKeys.NAME, initiator.getName()));
        if (!cryptoProvider.verifyProposal(proposal)) {
            throw new CryptoError("Identity proposal from %s failed verification".formatted(initiator.getName()));
        }

        final var response = responder.respondTo(proposal, capabilities);
        if (!cryptoProvider.verifyResponse(response, proposal)) {
            throw new CryptoError("Identity response from %s failed verification".formatted(responder.getName()));
        }

        final var eventA = initiator.cosignHandshake(proposal, response,
                                                     Map.of(PayloadKeys.SESSION_ID, sessionId,
                                                            PayloadKeys.PEER_NAME, responder.getName()));
        final var eventB = responder.cosignHandshake(proposal, response,
                                                     Map.of(PayloadKeys.SESSION_ID, sessionId,
                                                            PayloadKeys.PEER_NAME, initiator.getName()));
        log.info("Handshake {} <-> {} co-signed in session {}", initiator.getName(), responder.getName(), sessionId);
        return HandshakeResult.builder()
                .agentA(initiator.getName())
                .agentB(responder.getName())
                .agentAId(initiator.getAgentId())
                .agentBId(responder.getAgentId())
                .sessionId(sessionId)
                .eventAHash(cryptoProvider.digestEvent(eventA))
                .eventBHash(cryptoProvider.digestEvent(eventB))
                .timestamp(clock.instant().getEpochSecond())
                .build();
    }
}
