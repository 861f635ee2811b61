package com.flagship.finance_ledger.runtime;

/**
 * Raised by an {@link EventStore} when an append does not start at the expected version,
 * meaning another writer has already extended the entity's history.
 */
public class ConcurrentEntityModificationException extends IllegalStateException {

    public ConcurrentEntityModificationException(EntityKey key, long expectedVersion, Throwable cause) {
        super(String.format("Entity %s was modified concurrently (expected version %d)", key, expectedVersion), cause);
    }
}
