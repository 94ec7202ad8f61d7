package com.phonepe.cosign.core.model;

import lombok.experimental.UtilityClass;

/**
 * Well known keys inside an event payload
 */
@UtilityClass
public class PayloadKeys {
    public static final String EVENT_TYPE = "event_type";
    public static final String SESSION_ID = "session_id";
    public static final String PROTOCOL_VERSION = "protocol_version";
    public static final String PEER_AGENT_ID = "peer_agent_id";
    public static final String PEER_SIGNATURE = "peer_signature";
    public static final String PEER_NAME = "peer_name";
    public static final String INTERACTION_HASH = "interaction_hash";
    public static final String MY_ROLE = "my_role";
    public static final String PROPOSAL = "proposal";
    public static final String RESPONSE = "response";
    public static final String NAME = "name";
    public static final String PARTICIPANTS = "participants";
    public static final String PARTICIPANT_NAMES = "participant_names";
    public static final String AGENT_COUNT = "agent_count";
    public static final String DURATION_SECONDS = "duration_seconds";
    public static final String TOTAL_EVENTS = "total_events";
}
