package com.phonepe.cosign.core.crypto;

import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Ed25519CryptoProviderTest {

    private Ed25519CryptoProvider provider;
    private AgentIdentity alice;
    private AgentIdentity bob;

    @BeforeEach
    void setUp() {
        provider = new Ed25519CryptoProvider();
        alice = Ed25519Identities.generate();
        bob = Ed25519Identities.generate();
    }

    @Test
    void testSignAndVerifyEvent() {
        final var event = provider.signEvent(alice, Map.of("symbol_hash", "abc"), ProtocolConstants.GENESIS);
        assertAll(
                () -> assertEquals(alice.getAgentId(), event.getAgentId()),
                () -> assertEquals(ProtocolConstants.GENESIS, event.getPreviousHash()),
                () -> assertEquals(ProtocolConstants.EVENT_VERSION, event.getVersion()),
                () -> assertNotNull(event.getSignature()),
                () -> assertTrue(provider.verifyEvent(event, alice.getPublicKey())),
                () -> assertFalse(provider.verifyEvent(event, bob.getPublicKey()))
                 );
    }

    @Test
    @SneakyThrows
    void testEventVerifiesAfterJsonRoundTrip() {
        final var mapper = JsonUtils.createMapper();
        final var event = provider.signEvent(alice,
                                             Map.of("price_hash", new BigDecimal("182.50"),
                                                    "at_id", Instant.ofEpochSecond(1_700_000_000L, 5)),
                                             ProtocolConstants.GENESIS);
        final var read = mapper.readValue(mapper.writeValueAsString(event), SignedEvent.class);
        assertAll(
                () -> assertEquals(event, read),
                () -> assertEquals(182.5, read.getPayload().get("price_hash")),
                () -> assertTrue(provider.verifyEvent(read, alice.getPublicKey())),
                () -> assertEquals(provider.digestEvent(event), provider.digestEvent(read))
                 );
    }

    @Test
    void testMissingPreviousHashChainsToGenesis() {
        assertEquals(ProtocolConstants.GENESIS, provider.signEvent(alice, Map.of(), null).getPreviousHash());
    }

    @Test
    void testTamperedEventFailsVerification() {
        final var event = provider.signEvent(alice, Map.of("order_id", "X1"), ProtocolConstants.GENESIS);
        final var tamperedPayload = new HashMap<>(event.getPayload());
        tamperedPayload.put("order_id", "X2");

        assertFalse(provider.verifyEvent(event.toBuilder().payload(tamperedPayload).build(), alice.getPublicKey()));
        assertFalse(provider.verifyEvent(event.toBuilder().previousHash("other").build(), alice.getPublicKey()));
        assertFalse(provider.verifyEvent(event.withSignature(null), alice.getPublicKey()));
    }

    @Test
    void testDigestCoversSignature() {
        final var event = provider.signEvent(alice, Map.of("a", 1), ProtocolConstants.GENESIS);
        final var digest = provider.digestEvent(event);
        assertEquals(64, digest.length());
        assertEquals(digest, provider.digestEvent(event));
        assertNotEquals(digest, provider.digestEvent(event.withSignature("c2lnbmF0dXJl")));
    }

    @Test
    @SneakyThrows
    void testEventSurvivesJsonRoundTrip() {
        final var event = provider.signEvent(alice,
                                             Map.of("participants", List.of("a", "b"),
                                                    "agent_count", 2,
                                                    "confidence_hash", "x"),
                                             ProtocolConstants.GENESIS);
        final var mapper = JsonUtils.createMapper();
        final var reread = mapper.readValue(mapper.writeValueAsString(event), SignedEvent.class);

        assertEquals(provider.digestEvent(event), provider.digestEvent(reread));
        assertTrue(provider.verifyEvent(reread, alice.getPublicKey()));
    }

    @Test
    void testProposalAndResponse() {
        final var proposal = provider.buildIdentityProposal(alice,
                                                            ProtocolConstants.CAPABILITIES,
                                                            Map.of("session_id", "sess_1", "name", "alice"));
        assertTrue(provider.verifyProposal(proposal));
        assertEquals(ProtocolConstants.CAPABILITIES, proposal.getCapabilities());

        final var response = provider.buildIdentityResponse(bob, proposal, ProtocolConstants.CAPABILITIES);
        assertEquals(alice.getAgentId(), response.getProposerAgentId());
        assertTrue(provider.verifyResponse(response, proposal));

        final var otherProposal = provider.buildIdentityProposal(alice, ProtocolConstants.CAPABILITIES, Map.of());
        assertFalse(provider.verifyResponse(response, otherProposal));
    }

    @Test
    void testForgedProposalRejected() {
        final var proposal = provider.buildIdentityProposal(alice, ProtocolConstants.CAPABILITIES, Map.of());
        // claims alice's id but carries bob's key
        final var forged = provider.buildIdentityProposal(bob, ProtocolConstants.CAPABILITIES, Map.of())
                .toBuilder()
                .agentId(alice.getAgentId())
                .build();
        assertTrue(provider.verifyProposal(proposal));
        assertFalse(provider.verifyProposal(forged));
        assertFalse(provider.verifyProposal(proposal.withSignature("AAAA")));
    }

    @Test
    void testCosignedEventsEmbedSamePair() {
        final var proposal = provider.buildIdentityProposal(alice, ProtocolConstants.CAPABILITIES, Map.of());
        final var response = provider.buildIdentityResponse(bob, proposal, ProtocolConstants.CAPABILITIES);

        final var aliceSide = provider.buildCosignedEvent(alice, proposal, response, ProtocolConstants.GENESIS,
                                                          Map.of(PayloadKeys.SESSION_ID, "sess_1"));
        final var bobSide = provider.buildCosignedEvent(bob, proposal, response, "previous",
                                                        Map.of(PayloadKeys.SESSION_ID, "sess_1"));

        assertAll(
                () -> assertEquals(ProtocolConstants.HANDSHAKE_EVENT_TYPE, aliceSide.getEventType()),
                () -> assertEquals(bob.getAgentId(), aliceSide.getPayload().get(PayloadKeys.PEER_AGENT_ID)),
                () -> assertEquals(alice.getAgentId(), bobSide.getPayload().get(PayloadKeys.PEER_AGENT_ID)),
                () -> assertEquals(aliceSide.getPayload().get(PayloadKeys.PROPOSAL),
                                   bobSide.getPayload().get(PayloadKeys.PROPOSAL)),
                () -> assertEquals(aliceSide.getPayload().get(PayloadKeys.RESPONSE),
                                   bobSide.getPayload().get(PayloadKeys.RESPONSE)),
                () -> assertEquals("sess_1", bobSide.getPayload().get(PayloadKeys.SESSION_ID)),
                () -> assertEquals("previous", bobSide.getPreviousHash()),
                () -> assertTrue(provider.verifyEvent(aliceSide, alice.getPublicKey())),
                () -> assertTrue(provider.verifyEvent(bobSide, bob.getPublicKey()))
                 );
    }
}
