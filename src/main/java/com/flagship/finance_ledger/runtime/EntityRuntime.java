package com.flagship.finance_ledger.runtime;

import com.flagship.finance_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer execution per entity.
 *
 * Every command or query addressed to one {@link EntityKey} runs while holding that key's
 * fair lock, so work for one entity is processed one at a time in arrival order while
 * different entities proceed in parallel. The lock is reentrant, which lets a saga hold an
 * entity for its whole run while issuing individual commands to it.
 *
 * A key's lock only exists while some thread holds or waits for it, so the lock table
 * stays as small as the set of entities in use.
 *
 * Nested locking is only ever done in one direction (journal entry, then fiscal year or
 * account; account code index, then account), so there are no lock cycles.
 */
@Component
@Slf4j
public class EntityRuntime {

    private final Map<EntityKey, LockEntry> locks = new ConcurrentHashMap<>();

    public <R> R runExclusive(EntityKey key, Supplier<R> work) {
        LockEntry entry = acquire(key);
        entry.lock.lock();
        String previousKey = MDC.get(CorrelationContext.ENTITY_KEY_MDC_KEY);
        MDC.put(CorrelationContext.ENTITY_KEY_MDC_KEY, key.toString());
        try {
            return work.get();
        } finally {
            if (previousKey != null) {
                MDC.put(CorrelationContext.ENTITY_KEY_MDC_KEY, previousKey);
            } else {
                MDC.remove(CorrelationContext.ENTITY_KEY_MDC_KEY);
            }
            entry.lock.unlock();
            release(key);
        }
    }

    /**
     * Number of entities currently held or waited on.
     */
    int activeLocks() {
        return locks.size();
    }

    // users counts holders and waiters; the entry is dropped when the last one leaves
    private LockEntry acquire(EntityKey key) {
        return locks.compute(key, (k, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.users++;
            return current;
        });
    }

    private void release(EntityKey key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
