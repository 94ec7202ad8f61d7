package com.phonepe.cosign.core.store;

import com.phonepe.cosign.core.model.SignedEvent;

import java.util.List;

/**
 * Durable storage for signed events
 */
public interface EventStore {
    /**
     * Durably writes an event. Must throw {@link com.phonepe.cosign.core.errors.PersistenceError} if the event could
     * not be written; returning normally means the event is stored.
     */
    void persist(SignedEvent event);

    /**
     * All events stored for an agent in the order they were persisted
     */
    List<SignedEvent> events(String agentId);
}
