package com.flagship.finance_ledger.runtime;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Entity runtime tests.
 *
 * These tests verify that:
 * - Raised events are persisted and replayed into a fresh repository
 * - A failing command leaves no trace in memory or in the store
 * - Stale appends are rejected by the store
 * - Commands for one entity never interleave
 * - Compaction rewrites stored history without changing live state
 * - Locks and cached entities do not accumulate per entity touched
 */
class EntityRepositoryTest {

    private static final String ORG = "org-1";

    private InMemoryEventStore eventStore;
    private EntityRuntime runtime;
    private EntityRepository<Counter, CounterEvent> counters;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        runtime = new EntityRuntime();
        counters = new EntityRepository<>("Counter", CounterEvent.class, Counter::new, eventStore, runtime);
    }

    @Test
    @DisplayName("Events are persisted and replayed by a new repository")
    void testReplayFromStore() {
        counters.execute(ORG, "c1", counter -> counter.add(5));
        counters.execute(ORG, "c1", counter -> counter.add(7));

        EntityRepository<Counter, CounterEvent> fresh =
            new EntityRepository<>("Counter", CounterEvent.class, Counter::new, eventStore, new EntityRuntime());

        assertEquals(12, fresh.query(ORG, "c1", Counter::getTotal));
        assertEquals(2L, fresh.query(ORG, "c1", Counter::getVersion));
        assertEquals(List.of(EntityKey.of("Counter", ORG, "c1")), fresh.storedKeys());
    }

    @Test
    @DisplayName("A failing command is evicted and its events are never stored")
    void testFailedCommandEvicted() {
        counters.execute(ORG, "c1", counter -> counter.add(5));

        assertThrows(IllegalArgumentException.class, () -> counters.execute(ORG, "c1", counter -> {
            counter.add(100);
            return counter.add(-1);
        }));

        assertEquals(5, counters.query(ORG, "c1", Counter::getTotal));
        assertEquals(1, eventStore.load(counters.keyFor(ORG, "c1"), CounterEvent.class).size());
    }

    @Test
    @DisplayName("Querying an unknown entity does not create it")
    void testQueryUnknownEntity() {
        assertEquals(0, counters.query(ORG, "missing", Counter::getTotal));
        assertTrue(counters.storedKeys().isEmpty());
    }

    @Test
    @DisplayName("Appending at a stale version is rejected")
    void testStaleAppendRejected() {
        EntityKey key = counters.keyFor(ORG, "c1");
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        eventStore.append(key, 0, List.of(new CounterAddedEvent(1, now)));

        ConcurrentEntityModificationException exception = assertThrows(ConcurrentEntityModificationException.class,
            () -> eventStore.append(key, 0, List.of(new CounterAddedEvent(2, now))));

        assertTrue(exception.getMessage().contains("Counter/org-1/c1"));
        assertEquals(1, eventStore.load(key, CounterEvent.class).size());
    }

    @Test
    @DisplayName("Concurrent commands on one entity are serialized")
    void testConcurrentCommands() throws InterruptedException {
        int threadCount = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger failures = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    counters.execute(ORG, "shared", counter -> counter.add(1));
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, failures.get());
        assertEquals(threadCount, counters.query(ORG, "shared", Counter::getTotal));
        assertEquals(threadCount, eventStore.load(counters.keyFor(ORG, "shared"), CounterEvent.class).size());
    }

    @Test
    @DisplayName("Work inside exclusively can reenter the same entity")
    void testExclusivelyReenters() {
        int total = counters.exclusively(ORG, "c1", () -> {
            counters.execute(ORG, "c1", counter -> counter.add(3));
            return counters.execute(ORG, "c1", counter -> counter.add(4));
        });

        assertEquals(7, total);
    }

    @Test
    @DisplayName("Compaction replaces stored history with a snapshot")
    void testCompactReplacesHistory() {
        for (int i = 1; i <= 4; i++) {
            int amount = i;
            counters.execute(ORG, "c1", counter -> counter.add(amount));
        }
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        long version = counters.compact(ORG, "c1",
            counter -> List.of(new CounterAddedEvent(counter.getTotal(), now)));

        assertEquals(1L, version);
        assertEquals(1, eventStore.load(counters.keyFor(ORG, "c1"), CounterEvent.class).size());
        assertEquals(10, counters.query(ORG, "c1", Counter::getTotal));

        counters.execute(ORG, "c1", counter -> counter.add(5));
        EntityRepository<Counter, CounterEvent> fresh =
            new EntityRepository<>("Counter", CounterEvent.class, Counter::new, eventStore, new EntityRuntime());
        assertEquals(15, fresh.query(ORG, "c1", Counter::getTotal));
        assertEquals(2L, fresh.query(ORG, "c1", Counter::getVersion));
    }

    @Test
    @DisplayName("Compacting to an empty snapshot deletes the entity")
    void testCompactToEmptyDeletes() {
        counters.execute(ORG, "c1", counter -> counter.add(5));

        counters.compact(ORG, "c1", counter -> List.of());

        assertTrue(counters.storedKeys().isEmpty());
        assertEquals(0, counters.query(ORG, "c1", Counter::getTotal));
    }

    @Test
    @DisplayName("Replacing a stale history is rejected")
    void testStaleReplaceRejected() {
        EntityKey key = counters.keyFor(ORG, "c1");
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        eventStore.append(key, 0, List.of(new CounterAddedEvent(1, now), new CounterAddedEvent(2, now)));

        assertThrows(ConcurrentEntityModificationException.class,
            () -> eventStore.replace(key, 1, List.of(new CounterAddedEvent(3, now))));

        assertEquals(2, eventStore.load(key, CounterEvent.class).size());
    }

    @Test
    @DisplayName("Locks are released once no command holds or waits for them")
    void testLocksReleased() throws InterruptedException {
        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch doneLatch = new CountDownLatch(threadCount * 50);

        for (int i = 0; i < threadCount * 50; i++) {
            String entityId = "c" + (i % 25);
            executor.submit(() -> {
                try {
                    counters.execute(ORG, entityId, counter -> counter.add(1));
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, runtime.activeLocks());
        assertEquals(threadCount * 50, counters.storedKeys().stream()
            .mapToInt(key -> counters.query(ORG, key.getEntityId(), Counter::getTotal))
            .sum());
        assertEquals(0, runtime.activeLocks());
    }

    @Test
    @DisplayName("Cached entities are bounded and evicted ones are replayed")
    void testCacheBounded() {
        EntityRepository<Counter, CounterEvent> bounded = new EntityRepository<>("Counter", CounterEvent.class,
            Counter::new, eventStore, runtime, Caffeine.newBuilder().maximumSize(10).executor(Runnable::run));

        for (int i = 0; i < 100; i++) {
            bounded.execute(ORG, "c" + i, counter -> counter.add(2));
        }

        assertTrue(bounded.cachedEntities() <= 10);
        assertEquals(100, bounded.storedKeys().size());
        for (int i = 0; i < 100; i++) {
            assertEquals(2, bounded.query(ORG, "c" + i, Counter::getTotal));
        }
    }

    interface CounterEvent extends EntityEvent {
    }

    @Value
    static class CounterAddedEvent implements CounterEvent {
        int amount;
        Instant occurredAt;

        @Override
        public String getEventType() {
            return "CounterAdded";
        }
    }

    static class Counter extends EventSourcedEntity<CounterEvent> {
        private int total;

        int add(int amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Amount must not be negative");
            }
            raise(new CounterAddedEvent(amount, Instant.now()));
            return total;
        }

        int getTotal() {
            return total;
        }

        @Override
        protected void apply(CounterEvent event) {
            total += ((CounterAddedEvent) event).getAmount();
        }
    }
}
