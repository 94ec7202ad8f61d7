package com.phonepe.cosign.core.store;

import com.phonepe.cosign.core.model.SignedEvent;
import lombok.NonNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps events in memory only. Default store when nothing else is configured.
 */
public class InMemoryEventStore implements EventStore {
    private final Map<String, List<SignedEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void persist(@NonNull SignedEvent event) {
        events.computeIfAbsent(event.getAgentId(), agentId -> new CopyOnWriteArrayList<>())
                .add(event);
    }

    @Override
    public List<SignedEvent> events(String agentId) {
        return List.copyOf(events.getOrDefault(agentId, List.of()));
    }
}
