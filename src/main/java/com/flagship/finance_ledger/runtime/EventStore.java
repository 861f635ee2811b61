package com.flagship.finance_ledger.runtime;

import java.util.List;

/**
 * Durable, append-only history of entity events.
 *
 * Entry history is the source of truth; balances and statuses are projections rebuilt
 * by replaying {@link #load} in order.
 */
public interface EventStore {

    /**
     * Loads every event recorded for the entity, oldest first.
     */
    <E extends EntityEvent> List<E> load(EntityKey key, Class<E> eventType);

    /**
     * Appends events after {@code expectedVersion} existing events.
     *
     * @throws ConcurrentEntityModificationException if the history no longer ends at expectedVersion
     */
    void append(EntityKey key, long expectedVersion, List<? extends EntityEvent> events);

    /**
     * Replaces the entity's whole history with {@code events}, which must rebuild the same
     * live state. An empty list removes the entity from the store.
     *
     * Callers hold the entity's lock; this is how growing streams are compacted.
     *
     * @throws ConcurrentEntityModificationException if the history no longer ends at expectedVersion
     */
    void replace(EntityKey key, long expectedVersion, List<? extends EntityEvent> events);

    /**
     * Lists every entity of the given type that has at least one event.
     */
    List<EntityKey> keys(String entityType);
}
