/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.phonepe.cosign.session.verify;

import com.phonepe.cosign.core.crypto.Ed25519CryptoProvider;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.session.RandomSessionIdGenerator;
import com.phonepe.cosign.session.SessionCoordinator;
import com.phonepe.cosign.session.export.SessionExportReader;
import com.phonepe.cosign.session.model.AgentExport;
import com.phonepe.cosign.session.model.SessionExport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static com.phonepe.cosign.session.SessionTestUtils.agents;
import static com.phonepe.cosign.session.SessionTestUtils.session;
import static com.phonepe.cosign.session.SessionTestUtils.setup;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionVerifierTest {

    @TempDir
    Path tempDir;

    private SessionCoordinator session;
    private SessionVerifier verifier;

    @BeforeEach
    void setUp() {
        session = session("A", "B", "C").start();
        session.stamp("A", "advice", Map.of("symbol", "AAPL"), "B");
        session.stamp("C", "note", Map.of("order_id", "X1"));
        session.stamp("B", "order", Map.of("qty", 10), "C");
        verifier = new SessionVerifier(new Ed25519CryptoProvider());
    }

    @Test
    void testLiveSessionVerifies() {
        final var report = session.verify();
        assertAll(
                () -> assertTrue(report.isValid(), () -> report.getIssues().toString()),
                () -> assertEquals(session.getSessionId(), report.getSessionId()),
                () -> assertEquals(3, report.getAgentCount()),
                () -> assertEquals(session.summary().getTotalEvents(), report.getTotalEvents()),
                () -> assertEquals(report.getTotalEvents(), report.getVerifiedSignatures()),
                () -> assertEquals(3, report.getVerifiedHandshakes()),
                () -> assertEquals(2, report.getVerifiedInteractions())
                 );
    }

    @Test
    void testExportedFileVerifiesWithEmbeddedKeys() {
        session.end();
        final var read = new SessionExportReader().read(session.export(tempDir.resolve("audit.json")));
        final var report = verifier.verify(read);
        assertTrue(report.isValid(), () -> report.getIssues().toString());
        assertEquals(report.getTotalEvents(), report.getVerifiedSignatures());
    }

    @Test
    void testNonJsonNativeValuesSurviveExport() {
        session.stamp("A", "quote", Map.of("price_hash", new BigDecimal("182.50")));
        session.stamp("A", "tick", Map.of("at_id", Instant.ofEpochSecond(1_700_000_000L, 123_456_789)));
        session.stamp("B", "fill", Map.of("fill_id", new BigDecimal("1E+3")), "A");
        session.end();

        final var read = new SessionExportReader().read(session.export(tempDir.resolve("audit.json")));
        final var report = verifier.verify(read);
        assertTrue(session.verify().isValid(), () -> session.verify().getIssues().toString());
        assertTrue(report.isValid(), () -> report.getIssues().toString());
        assertEquals(report.getTotalEvents(), report.getVerifiedSignatures());
    }

    @Test
    void testTamperedPayloadDetected() {
        final var tampered = modifyEvents("C", events -> {
            final var note = events.stream()
                    .filter(event -> "note".equals(event.getEventType()))
                    .findFirst()
                    .orElseThrow();
            final var payload = new HashMap<>(note.getPayload());
            payload.put("order_id", "X2");
            events.set(events.indexOf(note), note.toBuilder().payload(payload).build());
            return events;
        });
        final var report = verifier.verify(tampered);
        assertFalse(report.isValid());
        assertTrue(hasIssue(report, IssueType.BAD_SIGNATURE, "C"));
    }

    @Test
    void testRemovedEventBreaksChain() {
        final var tampered = modifyEvents("A", events -> {
            events.remove(1);
            return events;
        });
        final var report = verifier.verify(tampered);
        assertTrue(hasIssue(report, IssueType.BROKEN_CHAIN, "A"));
        assertTrue(hasIssue(report, IssueType.COUNT_MISMATCH, "A"));
    }

    @Test
    void testMissingResponderEventDetected() {
        final var tampered = modifyEvents("B", events -> {
            events.removeIf(event -> "advice_received".equals(event.getEventType()));
            return events;
        });
        final var report = verifier.verify(tampered);
        assertTrue(hasIssue(report, IssueType.UNMATCHED_INTERACTION, "A"));
    }

    @Test
    void testForgedPeerSignatureDetected() {
        final var original = session.exportData();
        final var bEvents = original.getAgents().get("B").getEvents();
        final var received = bEvents.stream()
                .filter(event -> "advice_received".equals(event.getEventType()))
                .findFirst()
                .orElseThrow();
        final var payload = new HashMap<>(received.getPayload());
        payload.put(PayloadKeys.PEER_SIGNATURE, "forged");
        final var forged = received.toBuilder().payload(payload).build();
        final var tampered = modifyEvents("B", events -> {
            events.set(events.indexOf(received), forged);
            return events;
        });
        final var report = verifier.verify(tampered);
        assertTrue(hasIssue(report, IssueType.UNMATCHED_INTERACTION, "A"));
        assertTrue(hasIssue(report, IssueType.UNMATCHED_INTERACTION, "B"));
        assertTrue(hasIssue(report, IssueType.BAD_SIGNATURE, "B"));
    }

    @Test
    void testHandshakeRecordMustMatchLogs() {
        final var original = session.exportData();
        final var handshakes = new ArrayList<>(original.getSession().getHandshakes());
        handshakes.set(0, handshakes.get(0).toBuilder().eventBHash("0".repeat(64)).build());
        final var tampered = original.toBuilder()
                .session(original.getSession().toBuilder().handshakes(handshakes).build())
                .build();
        final var report = verifier.verify(tampered);
        assertTrue(report.getIssues()
                           .stream()
                           .anyMatch(issue -> issue.getType() == IssueType.HANDSHAKE_MISMATCH));
        assertEquals(2, report.getVerifiedHandshakes());
    }

    @Test
    void testForeignSessionEventDetected() {
        final var agents = agents("A", "B");
        final var other = new SessionCoordinator(agents.definitions(),
                                                 setup(agents).sessionIdGenerator(RandomSessionIdGenerator.seeded(1))
                                                         .build())
                .start();
        final var foreign = other.getAgent("A").events().get(0);
        final var tampered = modifyEvents("C", events -> {
            events.add(foreign);
            return events;
        });
        final var report = verifier.verify(tampered);
        assertTrue(hasIssue(report, IssueType.SESSION_MISMATCH, "C"));
        assertTrue(hasIssue(report, IssueType.AGENT_MISMATCH, "C"));
    }

    @Test
    void testUnknownKeysReported() {
        final var original = session.exportData();
        final var agents = new LinkedHashMap<String, AgentExport>();
        original.getAgents().forEach((name, agentExport) -> agents.put(name, agentExport.toBuilder()
                .events(agentExport.getEvents()
                                .stream()
                                .filter(event -> !"a2a_handshake".equals(event.getEventType()))
                                .toList())
                .build()));
        final var report = verifier.verify(original.toBuilder().agents(agents).build());
        assertTrue(hasIssue(report, IssueType.MISSING_KEY, "A"));
        assertEquals(0, report.getVerifiedSignatures());
    }

    private SessionExport modifyEvents(String agent, UnaryOperator<List<SignedEvent>> change) {
        final var original = session.exportData();
        final var agents = new LinkedHashMap<>(original.getAgents());
        final var agentExport = agents.get(agent);
        agents.put(agent, agentExport.toBuilder()
                .events(change.apply(new ArrayList<>(agentExport.getEvents())))
                .build());
        return original.toBuilder().agents(agents).build();
    }

    private static boolean hasIssue(VerificationReport report, IssueType type, String agent) {
        return report.getIssues()
                .stream()
                .anyMatch(issue -> issue.getType() == type && agent.equals(issue.getAgent()));
    }
}
