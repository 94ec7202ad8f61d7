package com.phonepe.cosign.core.crypto;

import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.model.IdentityProposal;
import com.phonepe.cosign.core.model.IdentityResponse;
import com.phonepe.cosign.core.model.SignedEvent;

import java.security.PublicKey;
import java.util.List;
import java.util.Map;

/**
 * Signing, verification and hashing primitives consumed by the session protocol. Implementations raise
 * {@link com.phonepe.cosign.core.errors.CryptoError} when an operation cannot be performed. Verification methods
 * return false for content that does not check out.
 */
public interface CryptoProvider {

    /**
     * Creates a signed event for the given payload, chained to {@code previousHash}
     */
    SignedEvent signEvent(AgentIdentity identity, Map<String, Object> payload, String previousHash);

    /**
     * Hash of a full event (signature included). This is the value the next event of the same log links to.
     */
    String digestEvent(SignedEvent event);

    IdentityProposal buildIdentityProposal(AgentIdentity identity,
                                           List<String> capabilities,
                                           Map<String, Object> metadata);

    IdentityResponse buildIdentityResponse(AgentIdentity identity,
                                           IdentityProposal proposal,
                                           List<String> capabilities);

    /**
     * Builds the handshake event one side records in its own log. Both sides embed the identical proposal/response
     * pair.
     *
     * @param extensions Extra payload fields covered by the signature (session binding, peer name)
     */
    SignedEvent buildCosignedEvent(AgentIdentity identity,
                                   IdentityProposal proposal,
                                   IdentityResponse response,
                                   String previousHash,
                                   Map<String, Object> extensions);

    boolean verifyEvent(SignedEvent event, PublicKey publicKey);

    /**
     * Checks the proposal signature against the key it carries and that the agent id derives from that key
     */
    boolean verifyProposal(IdentityProposal proposal);

    /**
     * Checks the response signature and that it answers exactly the given proposal
     */
    boolean verifyResponse(IdentityResponse response, IdentityProposal proposal);
}
