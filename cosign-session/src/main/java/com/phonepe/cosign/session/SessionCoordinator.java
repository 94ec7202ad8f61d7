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
package com.phonepe.cosign.session;

import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.cosign.core.digest.ContentDigest;
import com.phonepe.cosign.core.errors.AgentLookupError;
import com.phonepe.cosign.core.errors.ConfigurationError;
import com.phonepe.cosign.core.errors.CosignError;
import com.phonepe.cosign.core.errors.PersistenceError;
import com.phonepe.cosign.core.errors.SessionStateError;
import com.phonepe.cosign.core.handshake.HandshakeCoordinator;
import com.phonepe.cosign.core.handshake.HandshakeResult;
import com.phonepe.cosign.core.member.IdentityMember;
import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.model.EventPayloads;
import com.phonepe.cosign.core.model.PayloadKeys;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.session.model.AgentExport;
import com.phonepe.cosign.session.model.AgentSummary;
import com.phonepe.cosign.session.model.SessionExport;
import com.phonepe.cosign.session.model.SessionSummary;
import com.phonepe.cosign.session.verify.SessionVerifier;
import com.phonepe.cosign.session.verify.VerificationReport;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Binds a fixed, ordered set of agents into one session.
 * <p>
 * {@link #start()} stamps a {@code session_start} event into every log and then handshakes every unordered pair in
 * registration order. While started, {@link #stamp} records unilateral or co-signed events with redacted payloads.
 * {@link #end()} stamps {@code session_end} everywhere. The full audit can be exported once the session has started.
 * <p>
 * Not thread safe. Callers must serialize calls on one instance.
 */
@Slf4j
public class SessionCoordinator {
    public static final String DEFAULT_EXPORT_FILE = "session-audit.json";

    @Getter
    private final String sessionId;
    private final SessionSetup setup;
    private final List<IdentityMember> members;
    private final Map<String, IdentityMember> membersByName;
    private final HandshakeCoordinator handshakeCoordinator;
    private final List<HandshakeResult> handshakeRecords = new ArrayList<>();

    @Getter
    private SessionState state = SessionState.NOT_STARTED;
    private Long startedAt;

    public SessionCoordinator(List<AgentDefinition> agents, @NonNull SessionSetup setup) {
        if (agents == null || agents.size() < 2) {
            throw new ConfigurationError("A session needs at least 2 agents, got %d"
                                                 .formatted(agents == null ? 0 : agents.size()));
        }
        if (setup.getIdentityLoader() == null) {
            throw new ConfigurationError("No identity loader configured");
        }
        this.setup = setup;
        final var ordered = new ArrayList<IdentityMember>(agents.size());
        final var byName = new LinkedHashMap<String, IdentityMember>();
        final var agentIds = new HashSet<String>();
        for (final var definition : agents) {
            if (definition == null || Strings.isNullOrEmpty(definition.getName())) {
                throw new ConfigurationError("Every agent needs a name");
            }
            final var name = definition.getName();
            if (byName.containsKey(name)) {
                throw new ConfigurationError("Duplicate agent name: " + name);
            }
            final var identity = loadIdentity(definition);
            if (!agentIds.add(identity.getAgentId())) {
                throw new ConfigurationError("Agent %s shares identity %s with another agent"
                                                     .formatted(name, identity.getAgentId()));
            }
            final var member = new IdentityMember(name, identity, setup.getCryptoProvider(), setup.getEventStore());
            ordered.add(member);
            byName.put(name, member);
        }
        this.members = List.copyOf(ordered);
        this.membersByName = Collections.unmodifiableMap(byName);
        this.handshakeCoordinator = new HandshakeCoordinator(setup.getCryptoProvider(),
                                                             setup.getCapabilities(),
                                                             setup.getClock());
        this.sessionId = setup.getSessionIdGenerator().generate();
        if (Strings.isNullOrEmpty(sessionId)) {
            throw new ConfigurationError("Session id generator returned an empty id");
        }
        log.info("Session {} created with agents {}", sessionId, membersByName.keySet());
    }

    /**
     * Stamps {@code session_start} into every agent's log, then handshakes all N*(N-1)/2 pairs in registration order.
     *
     * @return this session, for chaining
     * @throws SessionStateError if the session is not in {@link SessionState#NOT_STARTED}
     */
    public SessionCoordinator start() {
        requireState(SessionState.NOT_STARTED, "start");
        startedAt = now();
        guarded("start", () -> {
            final var participants = members.stream().map(IdentityMember::getAgentId).toList();
            final var participantNames = members.stream().map(IdentityMember::getName).toList();
            for (final var member : members) {
                member.stamp(ProtocolConstants.SESSION_START_EVENT_TYPE,
                             Map.of(PayloadKeys.SESSION_ID, sessionId,
                                    PayloadKeys.PARTICIPANTS, participants,
                                    PayloadKeys.PARTICIPANT_NAMES, participantNames,
                                    PayloadKeys.AGENT_COUNT, members.size()),
                             sessionId);
            }
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    handshakeRecords.add(handshakeCoordinator.handshake(members.get(i), members.get(j), sessionId));
                }
            }
            return null;
        });
        state = SessionState.STARTED;
        log.info("Session {} started: {} agents, {} handshakes", sessionId, members.size(), handshakeRecords.size());
        return this;
    }

    /**
     * Unilateral stamp into one agent's log
     *
     * @see #stamp(String, String, Map, String)
     */
    public SignedEvent stamp(String agentName, String eventType, Map<String, ?> payload) {
        return stamp(agentName, eventType, payload, null);
    }

    /**
     * Stamps an event for an agent. Payload values are redacted through {@link PayloadRedactor} first.
     * <p>
     * With a peer, the stamp is co-signed: the agent logs {@code eventType} as initiator, then the peer logs
     * {@code eventType_received} as responder carrying the same interaction hash and the initiator's signature.
     *
     * @param agentName Acting agent
     * @param eventType Event type
     * @param payload   Raw payload, may be null
     * @param peer      Name of the counterparty or null for a unilateral stamp
     * @return The acting agent's event
     * @throws SessionStateError if the session is not started
     * @throws AgentLookupError  if the agent or the peer is unknown. Nothing is written in that case.
     * @throws IllegalArgumentException if the peer is the agent itself, or two payload keys redact to the same key
     */
    public SignedEvent stamp(String agentName, @NonNull String eventType, Map<String, ?> payload, String peer) {
        requireState(SessionState.STARTED, "stamp");
        final var agent = member(agentName);
        final var peerAgent = peer == null ? null : member(peer);
        Preconditions.checkArgument(agent != peerAgent, "Agent %s cannot co-sign with itself", agentName);
        final var redacted = PayloadRedactor.redact(payload);
        if (peerAgent == null) {
            return agent.stamp(eventType, redacted, sessionId);
        }

        final var interactionHash = ContentDigest.digest(
                agent.getAgentId() + ":" + peerAgent.getAgentId() + ":" + setup.getClock().instant());
        final var initiatorEvent = guarded("co-signed stamp", () -> {
            final var event = agent.stamp(eventType,
                                          EventPayloads.build(redacted,
                                                              Map.of(PayloadKeys.INTERACTION_HASH, interactionHash,
                                                                     PayloadKeys.MY_ROLE, ProtocolConstants.ROLE_INITIATOR)),
                                          sessionId,
                                          peerAgent.getAgentId(),
                                          null);
            peerAgent.stamp(eventType + ProtocolConstants.RECEIVED_SUFFIX,
                            EventPayloads.build(redacted,
                                                Map.of(PayloadKeys.INTERACTION_HASH, interactionHash,
                                                       PayloadKeys.MY_ROLE, ProtocolConstants.ROLE_RESPONDER)),
                            sessionId,
                            agent.getAgentId(),
                            event.getSignature());
            return event;
        });
        log.debug("Session {}: {} -> {} co-signed {}", sessionId, agent.getName(), peerAgent.getName(), eventType);
        return initiatorEvent;
    }

    /**
     * Stamps {@code session_end} into every agent's log and closes the session
     *
     * @return Summary after the end events were written
     */
    public SessionSummary end() {
        requireState(SessionState.STARTED, "end");
        final var duration = now() - startedAt;
        final var totalEvents = totalEvents();
        guarded("end", () -> {
            for (final var member : members) {
                member.stamp(ProtocolConstants.SESSION_END_EVENT_TYPE,
                             Map.of(PayloadKeys.SESSION_ID, sessionId,
                                    PayloadKeys.DURATION_SECONDS, duration,
                                    PayloadKeys.TOTAL_EVENTS, totalEvents),
                             sessionId);
            }
            return null;
        });
        state = SessionState.ENDED;
        log.info("Session {} ended after {}s with {} events", sessionId, duration, totalEvents);
        return summary();
    }

    public SessionSummary summary() {
        final var agents = new LinkedHashMap<String, AgentSummary>();
        membersByName.forEach((name, member) -> agents.put(name, AgentSummary.builder()
                .agentId(member.getAgentId())
                .eventCount(member.eventCount())
                .lastHash(member.getChainHead())
                .build()));
        return SessionSummary.builder()
                .sessionId(sessionId)
                .startedAt(startedAt)
                .state(state)
                .agents(Collections.unmodifiableMap(agents))
                .handshakes(List.copyOf(handshakeRecords))
                .handshakeCount(handshakeRecords.size())
                .totalEvents(totalEvents())
                .build();
    }

    /**
     * Full audit document: the summary plus every agent's complete log
     */
    public SessionExport exportData() {
        requireExportable();
        final var agents = new LinkedHashMap<String, AgentExport>();
        membersByName.forEach((name, member) -> {
            final var events = member.events();
            agents.put(name, AgentExport.builder()
                    .agentId(member.getAgentId())
                    .eventCount(events.size())
                    .events(events)
                    .build());
        });
        return SessionExport.builder()
                .session(summary())
                .agents(Collections.unmodifiableMap(agents))
                .build();
    }

    public Path export() {
        return export(Path.of(DEFAULT_EXPORT_FILE));
    }

    /**
     * Writes the audit document as JSON. Does not change any session or chain state.
     *
     * @return the path written
     */
    public Path export(@NonNull Path path) {
        final var data = exportData();
        try {
            final var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            setup.getMapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
        }
        catch (IOException e) {
            throw new PersistenceError("Could not write session export to " + path, e);
        }
        log.info("Session {} audit exported to {}", sessionId, path);
        return path;
    }

    /**
     * Writes the audit document to the stream. The stream is left open.
     */
    public void export(@NonNull OutputStream out) {
        final var data = exportData();
        try {
            setup.getMapper()
                    .writerWithDefaultPrettyPrinter()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(out, data);
        }
        catch (IOException e) {
            throw new PersistenceError("Could not write session export", e);
        }
    }

    /**
     * Checks every log of this session: chain links, signatures, handshakes and co-signed pairs
     */
    public VerificationReport verify() {
        final Map<String, PublicKey> keys = new LinkedHashMap<>();
        members.forEach(member -> keys.put(member.getAgentId(), member.getPublicKey()));
        return new SessionVerifier(setup.getCryptoProvider(), setup.getMapper())
                .verify(exportData(), agentId -> Optional.ofNullable(keys.get(agentId)));
    }

    public IdentityMember getAgent(String name) {
        return member(name);
    }

    /**
     * @return Read only view of all agents by name, in registration order
     */
    public Map<String, IdentityMember> agents() {
        return membersByName;
    }

    public List<HandshakeResult> handshakes() {
        return List.copyOf(handshakeRecords);
    }

    /**
     * @return Start time in epoch seconds, empty until {@link #start()} was called
     */
    public Optional<Long> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    private AgentIdentity loadIdentity(final AgentDefinition definition) {
        try {
            return Objects.requireNonNull(setup.getIdentityLoader().load(definition.getIdentitySource()),
                                          "Identity loader returned null");
        }
        catch (CosignError e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new ConfigurationError("Could not load identity for agent %s from %s"
                                                 .formatted(definition.getName(), definition.getIdentitySource()), e);
        }
    }

    private IdentityMember member(final String name) {
        final var member = name == null ? null : membersByName.get(name);
        if (member == null) {
            throw new AgentLookupError(name, membersByName.keySet());
        }
        return member;
    }

    /**
     * Runs a multi-event operation. If it fails after writing at least one event the session moves to
     * {@link SessionState#FAILED}; if nothing was written the state is left alone.
     */
    private <T> T guarded(final String operation, final Supplier<T> action) {
        final var before = totalEvents();
        try {
            return action.get();
        }
        catch (RuntimeException e) {
            if (totalEvents() != before) {
                state = SessionState.FAILED;
                log.error("Session {} failed during {}: {}", sessionId, operation, e.getMessage());
            }
            else if (state == SessionState.NOT_STARTED) {
                startedAt = null;
            }
            throw e;
        }
    }

    private void requireState(final SessionState required, final String operation) {
        if (state != required) {
            throw new SessionStateError("Cannot %s session %s in state %s".formatted(operation, sessionId, state));
        }
    }

    private void requireExportable() {
        if (state == SessionState.NOT_STARTED) {
            throw new SessionStateError("Session %s has not been started".formatted(sessionId));
        }
    }

    private long now() {
        return setup.getClock().instant().getEpochSecond();
    }

    private int totalEvents() {
        return members.stream().mapToInt(IdentityMember::eventCount).sum();
    }
}
