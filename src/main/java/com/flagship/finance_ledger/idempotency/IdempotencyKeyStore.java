package com.flagship.finance_ledger.idempotency;

import com.flagship.finance_ledger.idempotency.event.IdempotencyKeyEvent;
import com.flagship.finance_ledger.idempotency.event.KeyRegisteredEvent;
import com.flagship.finance_ledger.idempotency.event.KeyUsedEvent;
import com.flagship.finance_ledger.idempotency.event.KeyStoreCompactedEvent;
import com.flagship.finance_ledger.runtime.EventSourcedEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * All idempotency keys of one organization.
 *
 * An expired key that has not been swept yet is treated as absent: checks report it as
 * unknown and {@link #tryAcquire} registers it again.
 */
public class IdempotencyKeyStore extends EventSourcedEntity<IdempotencyKeyEvent> {

    private final Map<String, IdempotencyKey> keys = new LinkedHashMap<>();

    public String generateKey(String operation, UUID entityId, Duration ttl, Instant now) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Operation is required");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        String key;
        do {
            key = "idem_" + operation + "_" + UUID.randomUUID().toString().replace("-", "");
        } while (keys.containsKey(key));

        raise(new KeyRegisteredEvent(key, operation, entityId, now.plus(ttl), now));
        return key;
    }

    public KeyCheckResult checkKey(String key, Instant now) {
        return live(key, now).map(KeyCheckResult::of).orElse(KeyCheckResult.notFound());
    }

    /**
     * Records the outcome of the operation guarded by {@code key}, creating the key directly
     * in the used state when it is unknown.
     */
    public void markKeyUsed(String key, boolean successful, String resultHash, Duration defaultTtl, Instant now) {
        requireKey(key);
        Optional<IdempotencyKey> existing = live(key, now);
        String operation = existing.map(IdempotencyKey::getOperation).orElseGet(() -> operationOf(key));
        UUID entityId = existing.map(IdempotencyKey::getEntityId).orElse(null);
        Instant expiresAt = existing.map(IdempotencyKey::getExpiresAt).orElse(now.plus(defaultTtl));

        raise(new KeyUsedEvent(key, operation, entityId, successful, resultHash, expiresAt, now));
    }

    /**
     * Reserves {@code key} for one execution of {@code operation}.
     *
     * @return false only when the key records a successful completion
     */
    public boolean tryAcquire(String key, String operation, UUID entityId, Duration defaultTtl, Instant now) {
        requireKey(key);
        Optional<IdempotencyKey> existing = live(key, now);
        if (existing.isEmpty()) {
            raise(new KeyRegisteredEvent(key, operation, entityId, now.plus(defaultTtl), now));
            return true;
        }
        return !existing.get().isCompletedSuccessfully();
    }

    public int countExpired(Instant now) {
        return (int) keys.values().stream().filter(k -> k.isExpiredAt(now)).count();
    }

    /**
     * History that rebuilds only the keys still live at {@code now}: one snapshot event,
     * or nothing when every key has expired.
     */
    public List<IdempotencyKeyEvent> compactedHistory(Instant now) {
        List<IdempotencyKey> live = keys.values().stream()
            .filter(k -> !k.isExpiredAt(now))
            .toList();
        if (live.isEmpty()) {
            return List.of();
        }
        return List.of(new KeyStoreCompactedEvent(live, now));
    }

    public Optional<IdempotencyKey> getKeyStatus(String key, Instant now) {
        return live(key, now);
    }

    @Override
    protected void apply(IdempotencyKeyEvent event) {
        if (event instanceof KeyRegisteredEvent e) {
            keys.put(e.getKey(), IdempotencyKey.registered(
                e.getKey(), e.getOperation(), e.getEntityId(), e.getOccurredAt(), e.getExpiresAt()));
        } else if (event instanceof KeyUsedEvent e) {
            IdempotencyKey current = keys.get(e.getKey());
            if (current == null || current.isExpiredAt(e.getOccurredAt())) {
                current = IdempotencyKey.registered(
                    e.getKey(), e.getOperation(), e.getEntityId(), e.getOccurredAt(), e.getExpiresAt());
            }
            keys.put(e.getKey(), current.markUsed(e.isSuccessful(), e.getResultHash(), e.getOccurredAt()));
        } else if (event instanceof KeyStoreCompactedEvent e) {
            keys.clear();
            e.getKeys().forEach(k -> keys.put(k.getKey(), k));
        }
    }

    private Optional<IdempotencyKey> live(String key, Instant now) {
        IdempotencyKey found = keys.get(key);
        if (found == null || found.isExpiredAt(now)) {
            return Optional.empty();
        }
        return Optional.of(found);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }

    // idem_{operation}_{suffix}; caller-supplied keys may not follow the format
    private static String operationOf(String key) {
        if (key.startsWith("idem_")) {
            int end = key.lastIndexOf('_');
            if (end > "idem_".length()) {
                return key.substring("idem_".length(), end);
            }
        }
        return "unknown";
    }
}
