package com.flagship.finance_ledger.idempotency.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The operation guarded by a key finished. Creates the key if it was never registered.
 */
@Value
public class KeyUsedEvent implements IdempotencyKeyEvent {
    String key;
    String operation;
    UUID entityId;
    boolean successful;
    String resultHash;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "IdempotencyKeyUsed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
