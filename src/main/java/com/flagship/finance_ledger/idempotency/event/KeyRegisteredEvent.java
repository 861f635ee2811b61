package com.flagship.finance_ledger.idempotency.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A key was minted or reserved and is not yet used.
 */
@Value
public class KeyRegisteredEvent implements IdempotencyKeyEvent {
    String key;
    String operation;
    UUID entityId;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "IdempotencyKeyRegistered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
