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
package com.phonepe.cosign.session.model;

import com.phonepe.cosign.core.handshake.HandshakeResult;
import com.phonepe.cosign.session.SessionState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Point in time view of a session
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SessionSummary {
    String sessionId;

    /**
     * Epoch seconds, null until the session is started
     */
    Long startedAt;

    SessionState state;

    /**
     * Keyed by agent name, in registration order
     */
    Map<String, AgentSummary> agents;

    List<HandshakeResult> handshakes;

    int handshakeCount;

    int totalEvents;
}
