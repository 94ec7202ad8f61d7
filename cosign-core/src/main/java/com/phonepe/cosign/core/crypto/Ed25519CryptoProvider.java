package com.phonepe.cosign.core.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.cosign.core.digest.ContentDigest;
import com.phonepe.cosign.core.errors.CosignError;
import com.phonepe.cosign.core.errors.CryptoError;
import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.model.EventPayloads;
import com.phonepe.cosign.core.model.IdentityProposal;
import com.phonepe.cosign.core.model.IdentityResponse;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default {@link CryptoProvider}. Signs the canonical JSON form of an object (with its signature field unset) using
 * Ed25519 and hashes canonical JSON with SHA-256.
 */
@Slf4j
public class Ed25519CryptoProvider implements CryptoProvider {
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public Ed25519CryptoProvider() {
        this(JsonUtils.canonicalMapper(), Clock.systemUTC());
    }

    public Ed25519CryptoProvider(@NonNull ObjectMapper canonicalMapper, @NonNull Clock clock) {
        this.canonicalMapper = canonicalMapper;
        this.clock = clock;
    }

    @Override
    public SignedEvent signEvent(@NonNull AgentIdentity identity, Map<String, Object> payload, String previousHash) {
        final var unsigned = SignedEvent.builder()
                .version(ProtocolConstants.EVENT_VERSION)
                .agentId(identity.getAgentId())
                .timestamp(clock.instant().getEpochSecond())
                .nonce(UUID.randomUUID().toString())
                .payload(JsonUtils.normalize(canonicalMapper, EventPayloads.build(payload, Map.of())))
                .previousHash(Strings.isNullOrEmpty(previousHash) ? ProtocolConstants.GENESIS : previousHash)
                .build();
        return unsigned.withSignature(sign(identity.getPrivateKey(), unsigned));
    }

    @Override
    public String digestEvent(@NonNull SignedEvent event) {
        return ContentDigest.digestBytes(JsonUtils.canonicalBytes(canonicalMapper, event));
    }

    @Override
    public IdentityProposal buildIdentityProposal(@NonNull AgentIdentity identity,
                                                  List<String> capabilities,
                                                  Map<String, Object> metadata) {
        final var unsigned = IdentityProposal.builder()
                .version(ProtocolConstants.PROPOSAL_VERSION)
                .agentId(identity.getAgentId())
                .publicKey(Ed25519Identities.encodePublicKey(identity.getPublicKey()))
                .capabilities(capabilities == null ? List.of() : List.copyOf(capabilities))
                .metadata(EventPayloads.build(metadata, Map.of()))
                .timestamp(clock.instant().getEpochSecond())
                .nonce(UUID.randomUUID().toString())
                .build();
        return unsigned.withSignature(sign(identity.getPrivateKey(), unsigned));
    }

    @Override
    public IdentityResponse buildIdentityResponse(@NonNull AgentIdentity identity,
                                                  @NonNull IdentityProposal proposal,
                                                  List<String> capabilities) {
        final var unsigned = IdentityResponse.builder()
                .version(ProtocolConstants.RESPONSE_VERSION)
                .agentId(identity.getAgentId())
                .publicKey(Ed25519Identities.encodePublicKey(identity.getPublicKey()))
                .capabilities(capabilities == null ? List.of() : List.copyOf(capabilities))
                .proposerAgentId(proposal.getAgentId())
                .proposalHash(hash(proposal))
                .timestamp(clock.instant().getEpochSecond())
                .nonce(UUID.randomUUID().toString())
                .build();
        return unsigned.withSignature(sign(identity.getPrivateKey(), unsigned));
    }

    @Override
    public SignedEvent buildCosignedEvent(@NonNull AgentIdentity identity,
                                          @NonNull IdentityProposal proposal,
                                          @NonNull IdentityResponse response,
                                          String previousHash,
                                          Map<String, Object> extensions) {
        final var peerAgentId = identity.getAgentId().equals(proposal.getAgentId())
                ? response.getAgentId()
                : proposal.getAgentId();
        final var payload = new LinkedHashMap<String, Object>();
        payload.put(PayloadKeys.EVENT_TYPE, ProtocolConstants.HANDSHAKE_EVENT_TYPE);
        payload.put(PayloadKeys.PROTOCOL_VERSION, ProtocolConstants.PROTOCOL_VERSION);
        payload.put(PayloadKeys.PEER_AGENT_ID, peerAgentId);
        payload.put(PayloadKeys.PROPOSAL, JsonUtils.toMap(canonicalMapper, proposal));
        payload.put(PayloadKeys.RESPONSE, JsonUtils.toMap(canonicalMapper, response));
        return signEvent(identity, EventPayloads.build(payload, extensions), previousHash);
    }

    @Override
    public boolean verifyEvent(@NonNull SignedEvent event, @NonNull PublicKey publicKey) {
        return verify(publicKey, event.withSignature(null), event.getSignature());
    }

    @Override
    public boolean verifyProposal(@NonNull IdentityProposal proposal) {
        try {
            final var publicKey = Ed25519Identities.decodePublicKey(proposal.getPublicKey());
            if (!Ed25519Identities.deriveAgentId(publicKey).equals(proposal.getAgentId())) {
                log.warn("Proposal agent id {} does not match its public key", proposal.getAgentId());
                return false;
            }
            return verify(publicKey, proposal.withSignature(null), proposal.getSignature());
        }
        catch (CosignError e) {
            log.warn("Proposal from {} could not be verified: {}", proposal.getAgentId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean verifyResponse(@NonNull IdentityResponse response, @NonNull IdentityProposal proposal) {
        try {
            final var publicKey = Ed25519Identities.decodePublicKey(response.getPublicKey());
            if (!Ed25519Identities.deriveAgentId(publicKey).equals(response.getAgentId())) {
                log.warn("Response agent id {} does not match its public key", response.getAgentId());
                return false;
            }
            if (!proposal.getAgentId().equals(response.getProposerAgentId())
                    || !hash(proposal).equals(response.getProposalHash())) {
                log.warn("Response from {} does not answer proposal from {}",
                         response.getAgentId(), proposal.getAgentId());
                return false;
            }
            return verify(publicKey, response.withSignature(null), response.getSignature());
        }
        catch (CosignError e) {
            log.warn("Response from {} could not be verified: {}", response.getAgentId(), e.getMessage());
            return false;
        }
    }

    private String hash(final Object value) {
        return ContentDigest.digestBytes(JsonUtils.canonicalBytes(canonicalMapper, value));
    }

    private String sign(final PrivateKey privateKey, final Object unsigned) {
        try {
            final var signature = Signature.getInstance(Ed25519Identities.ALGORITHM);
            signature.initSign(privateKey);
            signature.update(JsonUtils.canonicalBytes(canonicalMapper, unsigned));
            return Base64.getEncoder().encodeToString(signature.sign());
        }
        catch (GeneralSecurityException e) {
            throw new CryptoError("Failed to sign " + unsigned.getClass().getSimpleName(), e);
        }
    }

    private boolean verify(final PublicKey publicKey, final Object unsigned, final String encodedSignature) {
        if (Strings.isNullOrEmpty(encodedSignature)) {
            return false;
        }
        try {
            final var signature = Signature.getInstance(Ed25519Identities.ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(JsonUtils.canonicalBytes(canonicalMapper, unsigned));
            return signature.verify(Base64.getDecoder().decode(encodedSignature));
        }
        catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature check failed: {}", e.getMessage());
            return false;
        }
    }
}
