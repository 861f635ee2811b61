package com.flagship.finance_ledger.runtime;

import java.time.Instant;

/**
 * Base interface for every persisted entity event.
 *
 * Events are facts: once appended to the {@link EventStore} they are never changed,
 * and replaying them in order rebuilds the entity's state exactly.
 */
public interface EntityEvent {

    /**
     * When this event occurred.
     */
    Instant getOccurredAt();

    /**
     * Event type name, also used as the JSON type discriminator.
     */
    String getEventType();
}
