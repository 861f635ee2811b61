package com.flagship.finance_ledger.idempotency;

import com.flagship.finance_ledger.idempotency.event.IdempotencyKeyEvent;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.runtime.EntityKey;
import com.flagship.finance_ledger.runtime.EntityRepository;
import com.flagship.finance_ledger.runtime.EntityRuntime;
import com.flagship.finance_ledger.runtime.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for idempotency key management.
 *
 * Each organization has one {@link IdempotencyKeyStore}. Callers guard a side-effecting
 * operation like this:
 * 1. {@code tryAcquire} the key; false means the operation already succeeded, so stop
 * 2. Perform the operation
 * 3. {@code markKeyUsed} with the outcome and a hash of the result
 *
 * A failed outcome leaves the key retryable; a successful one blocks re-execution until
 * the key expires.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String ENTITY_TYPE = "IdempotencyKeyStore";

    private final EntityRepository<IdempotencyKeyStore, IdempotencyKeyEvent> stores;
    private final Clock clock;
    private final Duration defaultTtl;
    private final LedgerMetrics metrics;

    public IdempotencyService(EventStore eventStore, EntityRuntime runtime, Clock clock,
                              @Value("${ledger.idempotency.default-ttl:PT24H}") Duration defaultTtl,
                              LedgerMetrics metrics) {
        this.stores = new EntityRepository<>(ENTITY_TYPE, IdempotencyKeyEvent.class,
            IdempotencyKeyStore::new, eventStore, runtime);
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.metrics = metrics;
    }

    public String generateKey(UUID organizationId, String operation, UUID entityId) {
        return generateKey(organizationId, operation, entityId, defaultTtl);
    }

    public String generateKey(UUID organizationId, String operation, UUID entityId, Duration ttl) {
        String key = stores.execute(orgKey(organizationId), orgKey(organizationId),
            store -> store.generateKey(operation, entityId, ttl, clock.instant()));
        log.debug("Generated idempotency key {} for {} on {}", key, operation, entityId);
        return key;
    }

    public KeyCheckResult checkKey(UUID organizationId, String key) {
        return stores.query(orgKey(organizationId), orgKey(organizationId),
            store -> store.checkKey(key, clock.instant()));
    }

    public void markKeyUsed(UUID organizationId, String key, boolean successful, String resultHash) {
        stores.execute(orgKey(organizationId), orgKey(organizationId), store -> {
            store.markKeyUsed(key, successful, resultHash, defaultTtl, clock.instant());
            return null;
        });
        log.info("Idempotency key {} marked used: successful={}", key, successful);
    }

    /**
     * Reserves the key before a side-effecting operation.
     *
     * @return true if the operation may run, false if it already completed successfully
     */
    public boolean tryAcquire(UUID organizationId, String key, String operation, UUID entityId) {
        boolean acquired = stores.execute(orgKey(organizationId), orgKey(organizationId),
            store -> store.tryAcquire(key, operation, entityId, defaultTtl, clock.instant()));
        if (acquired) {
            metrics.recordIdempotencyAcquired();
        } else {
            metrics.recordIdempotencyRefused();
            log.info("Refusing to re-execute {}: key {} already completed successfully", operation, key);
        }
        return acquired;
    }

    public int cleanupExpiredKeys(UUID organizationId) {
        return cleanup(orgKey(organizationId));
    }

    public Optional<IdempotencyKey> getKeyStatus(UUID organizationId, String key) {
        return stores.query(orgKey(organizationId), orgKey(organizationId),
            store -> store.getKeyStatus(key, clock.instant()));
    }

    /**
     * Sweeps expired keys from every organization's store.
     *
     * @return total number of keys removed
     */
    public int cleanupAllExpiredKeys() {
        int removed = 0;
        List<EntityKey> keys = stores.storedKeys();
        for (EntityKey storeKey : keys) {
            removed += cleanup(storeKey.getOrganizationId());
        }
        return removed;
    }

    // expired keys are dropped from stored history, not just from the live view
    private int cleanup(String organizationId) {
        Instant now = clock.instant();
        int removed = stores.exclusively(organizationId, organizationId, () -> {
            int expired = stores.query(organizationId, organizationId, store -> store.countExpired(now));
            if (expired > 0) {
                stores.compact(organizationId, organizationId, store -> store.compactedHistory(now));
            }
            return expired;
        });
        if (removed > 0) {
            metrics.recordKeysPurged(removed);
            log.info("Removed {} expired idempotency key(s) for organization {}", removed, organizationId);
        }
        return removed;
    }

    private static String orgKey(UUID organizationId) {
        if (organizationId == null) {
            throw new IllegalArgumentException("Organization ID is required");
        }
        return organizationId.toString();
    }
}
