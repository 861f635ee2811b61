package com.flagship.finance_ledger.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for entities whose state is a projection of their event history.
 *
 * Commands validate first and then call {@link #raise(EntityEvent)}, which applies the
 * event to in-memory state and queues it for persistence. Replay calls {@link #apply}
 * directly, so apply methods must never validate or have side effects.
 *
 * Instances are not thread-safe; {@link EntityRepository} only touches them while holding
 * the entity's lock.
 *
 * @param <E> the entity's event type
 */
public abstract class EventSourcedEntity<E extends EntityEvent> {

    private final List<E> pendingEvents = new ArrayList<>();
    private long version;

    protected abstract void apply(E event);

    protected void raise(E event) {
        apply(event);
        pendingEvents.add(event);
    }

    void replay(List<? extends E> history) {
        for (E event : history) {
            apply(event);
            version++;
        }
    }

    List<E> pendingEvents() {
        return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
    }

    void markCommitted() {
        version += pendingEvents.size();
        pendingEvents.clear();
    }

    /**
     * Number of events persisted for this entity.
     */
    public long getVersion() {
        return version;
    }
}
