package com.flagship.finance_ledger.idempotency;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One idempotency key and the outcome of the operation it guards.
 *
 * Key principles:
 * - A key is used at most once per successful execution
 * - A failed or unfinished use leaves the operation retryable
 * - Expired keys behave as if they were never issued
 */
@Value
public class IdempotencyKey {
    String key;
    String operation;
    UUID entityId;
    Instant createdAt;
    Instant expiresAt;
    boolean used;
    Instant usedAt;
    boolean successful;
    String resultHash;

    public static IdempotencyKey registered(String key, String operation, UUID entityId,
                                            Instant createdAt, Instant expiresAt) {
        return new IdempotencyKey(key, operation, entityId, createdAt, expiresAt,
            false, null, false, null);
    }

    /**
     * Returns the key in the used state, keeping its creation time.
     */
    public IdempotencyKey markUsed(boolean successful, String resultHash, Instant usedAt) {
        return new IdempotencyKey(key, operation, entityId, createdAt, expiresAt,
            true, usedAt, successful, resultHash);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }

    /**
     * True when the guarded operation is known to have completed successfully,
     * so it must not run again.
     */
    @JsonIgnore
    public boolean isCompletedSuccessfully() {
        return used && successful;
    }
}
