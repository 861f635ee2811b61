package com.flagship.finance_ledger.idempotency;

import lombok.Value;

/**
 * Read-only view of a key for {@code checkKey}.
 */
@Value
public class KeyCheckResult {
    boolean exists;
    boolean alreadyUsed;
    Boolean previousSuccess;
    String previousResultHash;

    public static KeyCheckResult notFound() {
        return new KeyCheckResult(false, false, null, null);
    }

    static KeyCheckResult of(IdempotencyKey key) {
        if (!key.isUsed()) {
            return new KeyCheckResult(true, false, null, null);
        }
        return new KeyCheckResult(true, true, key.isSuccessful(), key.getResultHash());
    }
}
