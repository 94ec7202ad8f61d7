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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.cosign.core.crypto.CryptoProvider;
import com.phonepe.cosign.core.crypto.Ed25519CryptoProvider;
import com.phonepe.cosign.core.crypto.IdentityLoader;
import com.phonepe.cosign.core.model.ProtocolConstants;
import com.phonepe.cosign.core.store.EventStore;
import com.phonepe.cosign.core.store.InMemoryEventStore;
import com.phonepe.cosign.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Collaborators and settings for a {@link SessionCoordinator}. Everything except the identity loader has a default.
 */
@Value
@Builder
public class SessionSetup {
    /**
     * Used for export and export reading. If not provided, a default one will be created.
     */
    ObjectMapper mapper;

    /**
     * Signs, hashes and verifies everything. Defaults to Ed25519.
     */
    CryptoProvider cryptoProvider;

    /**
     * Where every stamped event is written before it is appended to an agent's log. Defaults to an in-memory store.
     */
    EventStore eventStore;

    /**
     * Resolves {@link AgentDefinition#getIdentitySource()} into keys. Required, the session fails to build without it.
     */
    IdentityLoader identityLoader;

    SessionIdGenerator sessionIdGenerator;

    /**
     * Time source for the session and, when no crypto provider is given, for the default one's event timestamps
     */
    Clock clock;

    /**
     * Capabilities advertised in handshakes
     */
    List<String> capabilities;

    public SessionSetup(
            ObjectMapper mapper,
            CryptoProvider cryptoProvider,
            EventStore eventStore,
            IdentityLoader identityLoader,
            SessionIdGenerator sessionIdGenerator,
            Clock clock,
            List<String> capabilities) {
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.cryptoProvider = Objects.requireNonNullElseGet(
                cryptoProvider, () -> new Ed25519CryptoProvider(JsonUtils.canonicalMapper(), this.clock));
        this.eventStore = Objects.requireNonNullElseGet(eventStore, InMemoryEventStore::new);
        this.identityLoader = identityLoader;
        this.sessionIdGenerator = Objects.requireNonNullElseGet(sessionIdGenerator, RandomSessionIdGenerator::new);
        this.capabilities = List.copyOf(Objects.requireNonNullElse(capabilities, ProtocolConstants.CAPABILITIES));
    }
}
