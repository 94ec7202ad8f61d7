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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.cosign.core.crypto.CryptoProvider;
import com.phonepe.cosign.core.crypto.Ed25519Identities;
import com.phonepe.cosign.core.errors.CosignError;
import com.phonepe.cosign.core.handshake.HandshakeResult;
import com.phonepe.cosign.core.model.IdentityProposal;
import com.phonepe.cosign.core.model.IdentityResponse;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.core.utils.JsonUtils;
import com.phonepe.cosign.session.model.AgentExport;
import com.phonepe.cosign.session.model.AgentSummary;
import com.phonepe.cosign.session.model.SessionExport;
import com.phonepe.cosign.session.model.SessionSummary;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks a session audit end to end:
 * <ul>
 *     <li>each agent's log links back to genesis and matches the summary's chain head and counts</li>
 *     <li>every event carries a valid signature of the agent that owns the log</li>
 *     <li>every event belongs to the exported session</li>
 *     <li>every handshake record points at handshake events in both logs built from the same proposal and response</li>
 *     <li>every co-signed interaction has both sides, sharing the interaction hash and the initiator's signature</li>
 * </ul>
 * Public keys come from the supplied resolver. Agents it does not know are checked against the keys embedded in the
 * verified handshake proposals and responses of the audit.
 */
@Slf4j
public class SessionVerifier {
    private final CryptoProvider cryptoProvider;
    private final ObjectMapper mapper;

    public SessionVerifier(@NonNull CryptoProvider cryptoProvider) {
        this(cryptoProvider, JsonUtils.createMapper());
    }

    public SessionVerifier(@NonNull CryptoProvider cryptoProvider, @NonNull ObjectMapper mapper) {
        this.cryptoProvider = cryptoProvider;
        this.mapper = mapper;
    }

    public VerificationReport verify(@NonNull SessionExport export) {
        return verify(export, agentId -> Optional.empty());
    }

    public VerificationReport verify(@NonNull SessionExport export,
                                     @NonNull Function<String, Optional<PublicKey>> keyResolver) {
        final var session = Objects.requireNonNullElseGet(export.getSession(), () -> SessionSummary.builder().build());
        final var agents = Objects.requireNonNullElse(export.getAgents(), Map.<String, AgentExport>of());
        final var context = new Context(session, agents);
        final var embeddedKeys = embeddedKeys(agents);
        final Function<String, Optional<PublicKey>> keys = agentId -> keyResolver.apply(agentId)
                .or(() -> Optional.ofNullable(embeddedKeys.get(agentId)));

        agents.forEach((name, agentExport) -> verifyLog(context, name, agentExport, keys));
        if (session.getTotalEvents() != context.totalEvents) {
            context.issue(IssueType.COUNT_MISMATCH, null, null,
                          "Summary reports %d events, logs hold %d".formatted(session.getTotalEvents(),
                                                                              context.totalEvents));
        }
        verifyHandshakes(context);
        verifyInteractions(context);

        final var report = context.build();
        if (report.isValid()) {
            log.info("Session {} verified: {} events, {} handshakes, {} interactions",
                     report.getSessionId(), report.getTotalEvents(),
                     report.getVerifiedHandshakes(), report.getVerifiedInteractions());
        }
        else {
            log.warn("Session {} failed verification with {} issues", report.getSessionId(), report.getIssues().size());
        }
        return report;
    }

    private void verifyLog(final Context context,
                           final String name,
                           final AgentExport agentExport,
                           final Function<String, Optional<PublicKey>> keys) {
        final var events = Objects.requireNonNullElse(agentExport.getEvents(), List.<SignedEvent>of());
        if (agentExport.getEventCount() != events.size()) {
            context.issue(IssueType.COUNT_MISMATCH, name, null,
                          "Export reports %d events, log holds %d".formatted(agentExport.getEventCount(),
                                                                             events.size()));
        }
        final var key = keys.apply(agentExport.getAgentId()).orElse(null);
        if (key == null) {
            context.issue(IssueType.MISSING_KEY, name, null,
                          "No public key known for agent " + agentExport.getAgentId());
        }
        final var byHash = new HashMap<String, SignedEvent>();
        var expectedPrevious = ProtocolConstants.GENESIS;
        for (int i = 0; i < events.size(); i++) {
            final var event = events.get(i);
            if (!Objects.equals(agentExport.getAgentId(), event.getAgentId())) {
                context.issue(IssueType.AGENT_MISMATCH, name, i,
                              "Event issued by %s in log of %s".formatted(event.getAgentId(),
                                                                          agentExport.getAgentId()));
            }
            if (!Objects.equals(expectedPrevious, event.getPreviousHash())) {
                context.issue(IssueType.BROKEN_CHAIN, name, i,
                              "Expected previous hash %s, found %s".formatted(expectedPrevious,
                                                                              event.getPreviousHash()));
            }
            final var eventSession = event.payloadString(PayloadKeys.SESSION_ID).orElse(null);
            if (!Objects.equals(context.sessionId, eventSession)) {
                context.issue(IssueType.SESSION_MISMATCH, name, i, "Event belongs to session " + eventSession);
            }
            if (key != null) {
                if (cryptoProvider.verifyEvent(event, key)) {
                    context.verifiedSignatures++;
                }
                else {
                    context.issue(IssueType.BAD_SIGNATURE, name, i, "Signature does not verify");
                }
            }
            expectedPrevious = cryptoProvider.digestEvent(event);
            byHash.put(expectedPrevious, event);
            context.track(name, i, event);
        }
        context.totalEvents += events.size();
        context.eventsByHash.put(name, byHash);

        final AgentSummary summary = context.summaryAgents.get(name);
        if (summary == null) {
            context.issue(IssueType.COUNT_MISMATCH, name, null, "Agent missing from session summary");
            return;
        }
        if (summary.getEventCount() != events.size()) {
            context.issue(IssueType.COUNT_MISMATCH, name, null,
                          "Summary reports %d events, log holds %d".formatted(summary.getEventCount(),
                                                                              events.size()));
        }
        if (!Objects.equals(summary.getLastHash(), expectedPrevious)) {
            context.issue(IssueType.CHAIN_HEAD_MISMATCH, name, null,
                          "Summary chain head %s does not match log head %s".formatted(summary.getLastHash(),
                                                                                       expectedPrevious));
        }
    }

    private void verifyHandshakes(final Context context) {
        final var handshakes = Objects.requireNonNullElse(context.session.getHandshakes(), List.<HandshakeResult>of());
        if (context.session.getHandshakeCount() != handshakes.size()) {
            context.issue(IssueType.COUNT_MISMATCH, null, null,
                          "Summary reports %d handshakes, lists %d".formatted(context.session.getHandshakeCount(),
                                                                              handshakes.size()));
        }
        for (final var record : handshakes) {
            final var eventA = context.eventByHash(record.getAgentA(), record.getEventAHash());
            final var eventB = context.eventByHash(record.getAgentB(), record.getEventBHash());
            final var problem = handshakeProblem(record, eventA, eventB);
            if (problem == null) {
                context.verifiedHandshakes++;
            }
            else {
                context.issue(IssueType.HANDSHAKE_MISMATCH, null, null,
                              "Handshake %s <-> %s: %s".formatted(record.getAgentA(), record.getAgentB(), problem));
            }
        }
    }

    private static String handshakeProblem(final HandshakeResult record,
                                           final SignedEvent eventA,
                                           final SignedEvent eventB) {
        if (eventA == null || eventB == null) {
            return "event missing from %s log".formatted(eventA == null ? "initiator" : "responder");
        }
        if (!ProtocolConstants.HANDSHAKE_EVENT_TYPE.equals(eventA.getEventType())
                || !ProtocolConstants.HANDSHAKE_EVENT_TYPE.equals(eventB.getEventType())) {
            return "referenced events are not handshakes";
        }
        if (!Objects.equals(record.getAgentBId(), eventA.getPayload().get(PayloadKeys.PEER_AGENT_ID))
                || !Objects.equals(record.getAgentAId(), eventB.getPayload().get(PayloadKeys.PEER_AGENT_ID))) {
            return "events do not reference each other";
        }
        if (!Objects.equals(eventA.getPayload().get(PayloadKeys.PROPOSAL), eventB.getPayload().get(PayloadKeys.PROPOSAL))
                || !Objects.equals(eventA.getPayload().get(PayloadKeys.RESPONSE),
                                   eventB.getPayload().get(PayloadKeys.RESPONSE))) {
            return "events embed different proposal or response";
        }
        return null;
    }

    private void verifyInteractions(final Context context) {
        final var responders = new HashMap<String, List<TrackedEvent>>();
        context.tracked.stream()
                .filter(tracked -> ProtocolConstants.ROLE_RESPONDER.equals(role(tracked.event())))
                .forEach(tracked -> responders.computeIfAbsent(interactionHash(tracked.event()),
                                                               hash -> new ArrayList<>())
                        .add(tracked));
        final Set<TrackedEvent> matched = new HashSet<>();
        context.tracked.stream()
                .filter(tracked -> ProtocolConstants.ROLE_INITIATOR.equals(role(tracked.event())))
                .forEach(initiator -> {
                    final var counterpart = responders.getOrDefault(interactionHash(initiator.event()), List.of())
                            .stream()
                            .filter(candidate -> !matched.contains(candidate))
                            .filter(candidate -> isCounterpart(initiator.event(), candidate.event()))
                            .findFirst();
                    if (counterpart.isPresent()) {
                        matched.add(counterpart.get());
                        context.verifiedInteractions++;
                    }
                    else {
                        context.issue(IssueType.UNMATCHED_INTERACTION, initiator.agent(), initiator.index(),
                                      "No co-signed counterpart for %s".formatted(initiator.event().getEventType()));
                    }
                });
        responders.values()
                .stream()
                .flatMap(List::stream)
                .filter(tracked -> !matched.contains(tracked))
                .forEach(tracked -> context.issue(IssueType.UNMATCHED_INTERACTION, tracked.agent(), tracked.index(),
                                                  "No initiator event for %s".formatted(tracked.event()
                                                                                                .getEventType())));
    }

    private static boolean isCounterpart(final SignedEvent initiator, final SignedEvent responder) {
        final var payload = responder.getPayload();
        return Objects.equals(responder.getAgentId(), initiator.getPayload().get(PayloadKeys.PEER_AGENT_ID))
                && Objects.equals(initiator.getAgentId(), payload.get(PayloadKeys.PEER_AGENT_ID))
                && Objects.equals(initiator.getSignature(), payload.get(PayloadKeys.PEER_SIGNATURE))
                && Objects.equals(initiator.getEventType() + ProtocolConstants.RECEIVED_SUFFIX,
                                  responder.getEventType());
    }

    private static String role(final SignedEvent event) {
        return event.payloadString(PayloadKeys.MY_ROLE).orElse(null);
    }

    private static String interactionHash(final SignedEvent event) {
        return event.payloadString(PayloadKeys.INTERACTION_HASH).orElse("");
    }

    /**
     * Keys of every agent that appears in a handshake whose proposal (and response) verify on their own.
     * Agent ids are derived from the keys, so a verified proposal binds the key to the id.
     */
    private Map<String, PublicKey> embeddedKeys(final Map<String, AgentExport> agents) {
        final var keys = new HashMap<String, PublicKey>();
        agents.values()
                .stream()
                .flatMap(agentExport -> Objects.requireNonNullElse(agentExport.getEvents(), List.<SignedEvent>of())
                        .stream())
                .filter(event -> ProtocolConstants.HANDSHAKE_EVENT_TYPE.equals(event.getEventType()))
                .forEach(event -> {
                    try {
                        final var proposal = mapper.convertValue(event.getPayload().get(PayloadKeys.PROPOSAL),
                                                                 IdentityProposal.class);
                        final var response = mapper.convertValue(event.getPayload().get(PayloadKeys.RESPONSE),
                                                                 IdentityResponse.class);
                        if (proposal != null && cryptoProvider.verifyProposal(proposal)) {
                            keys.putIfAbsent(proposal.getAgentId(),
                                             Ed25519Identities.decodePublicKey(proposal.getPublicKey()));
                            if (response != null && cryptoProvider.verifyResponse(response, proposal)) {
                                keys.putIfAbsent(response.getAgentId(),
                                                 Ed25519Identities.decodePublicKey(response.getPublicKey()));
                            }
                        }
                    }
                    catch (IllegalArgumentException | CosignError e) {
                        log.warn("Ignoring unreadable handshake material in log of {}: {}",
                                 event.getAgentId(), e.getMessage());
                    }
                });
        return keys;
    }

    private record TrackedEvent(
            String agent,
            int index,
            SignedEvent event
    ) {
    }

    private static final class Context {
        private final SessionSummary session;
        private final String sessionId;
        private final Map<String, AgentSummary> summaryAgents;
        private final VerificationReport.VerificationReportBuilder report;
        private final Map<String, Map<String, SignedEvent>> eventsByHash = new HashMap<>();
        private final List<TrackedEvent> tracked = new ArrayList<>();
        private int totalEvents;
        private int verifiedSignatures;
        private int verifiedHandshakes;
        private int verifiedInteractions;

        private Context(SessionSummary session, Map<String, AgentExport> agents) {
            this.session = session;
            this.sessionId = session.getSessionId();
            this.summaryAgents = Objects.requireNonNullElse(session.getAgents(), Map.of());
            this.report = VerificationReport.builder()
                    .sessionId(sessionId)
                    .agentCount(agents.size());
        }

        private void track(String agent, int index, SignedEvent event) {
            tracked.add(new TrackedEvent(agent, index, event));
        }

        private SignedEvent eventByHash(String agent, String hash) {
            return eventsByHash.getOrDefault(agent, Map.of()).get(hash);
        }

        private VerificationReport build() {
            return report.totalEvents(totalEvents)
                    .verifiedSignatures(verifiedSignatures)
                    .verifiedHandshakes(verifiedHandshakes)
                    .verifiedInteractions(verifiedInteractions)
                    .build();
        }

        private void issue(IssueType type, String agent, Integer index, String message) {
            report.issue(VerificationIssue.builder()
                                 .type(type)
                                 .agent(agent)
                                 .eventIndex(index)
                                 .message(message)
                                 .build());
        }
    }
}
