package com.flagship.finance_ledger.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local event store. Used by default and in tests.
 *
 * Each stream is an immutable list swapped atomically on every write, so readers never
 * see a partially appended batch.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final Map<EntityKey, List<EntityEvent>> streams = new ConcurrentHashMap<>();

    @Override
    public <E extends EntityEvent> List<E> load(EntityKey key, Class<E> eventType) {
        List<EntityEvent> stream = streams.getOrDefault(key, List.of());
        List<E> events = new ArrayList<>(stream.size());
        for (EntityEvent event : stream) {
            events.add(eventType.cast(event));
        }
        return events;
    }

    @Override
    public void append(EntityKey key, long expectedVersion, List<? extends EntityEvent> events) {
        streams.compute(key, (k, stream) -> {
            List<EntityEvent> current = stream != null ? stream : List.of();
            requireVersion(key, current, expectedVersion);
            List<EntityEvent> appended = new ArrayList<>(current.size() + events.size());
            appended.addAll(current);
            appended.addAll(events);
            return List.copyOf(appended);
        });
        log.debug("Appended {} event(s) to {}", events.size(), key);
    }

    @Override
    public void replace(EntityKey key, long expectedVersion, List<? extends EntityEvent> events) {
        streams.compute(key, (k, stream) -> {
            requireVersion(key, stream != null ? stream : List.of(), expectedVersion);
            return events.isEmpty() ? null : List.copyOf(events);
        });
        log.debug("Replaced {} event(s) of {} with {}", expectedVersion, key, events.size());
    }

    @Override
    public List<EntityKey> keys(String entityType) {
        return streams.keySet().stream()
                .filter(key -> key.getEntityType().equals(entityType))
                .toList();
    }

    private static void requireVersion(EntityKey key, List<EntityEvent> stream, long expectedVersion) {
        if (stream.size() != expectedVersion) {
            throw new ConcurrentEntityModificationException(key, expectedVersion, null);
        }
    }
}
