package com.phonepe.cosign.core.model;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Fixed vocabulary of the co-signed session protocol
 */
@UtilityClass
public class ProtocolConstants {
    /**
     * Chain head of an agent that has not logged anything yet
     */
    public static final String GENESIS = "genesis";

    /**
     * Tag embedded into every stamped payload
     */
    public static final String PROTOCOL_VERSION = "COSIGN-1";

    public static final String EVENT_VERSION = "cosign-event/1";
    public static final String PROPOSAL_VERSION = "cosign-proposal/1";
    public static final String RESPONSE_VERSION = "cosign-response/1";

    public static final List<String> CAPABILITIES = List.of("stamp", "verify", "a2a", "session");

    public static final String HANDSHAKE_EVENT_TYPE = "a2a_handshake";
    public static final String SESSION_START_EVENT_TYPE = "session_start";
    public static final String SESSION_END_EVENT_TYPE = "session_end";
    public static final String RECEIVED_SUFFIX = "_received";

    public static final String ROLE_INITIATOR = "initiator";
    public static final String ROLE_RESPONDER = "responder";
}
