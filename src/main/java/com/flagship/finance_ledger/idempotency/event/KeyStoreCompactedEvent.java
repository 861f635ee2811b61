package com.flagship.finance_ledger.idempotency.event;

import com.flagship.finance_ledger.idempotency.IdempotencyKey;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of every live key. Replaces the store's whole history when expired keys are swept.
 */
@Value
public class KeyStoreCompactedEvent implements IdempotencyKeyEvent {
    List<IdempotencyKey> keys;
    Instant occurredAt;

    public static final String EVENT_TYPE = "IdempotencyKeyStoreCompacted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
