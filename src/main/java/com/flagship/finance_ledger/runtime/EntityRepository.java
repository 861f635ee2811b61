package com.flagship.finance_ledger.runtime;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loads, caches and persists one kind of event-sourced entity.
 *
 * A command runs under the entity's lock:
 * 1. The entity is taken from the cache, or rebuilt by replaying its stored events
 * 2. The command mutates it, raising events
 * 3. Raised events are appended to the {@link EventStore}
 *
 * If the command (or the append) throws, the cached instance is evicted so the next access
 * rebuilds it from stored history. State is therefore never ahead of what was persisted.
 *
 * The cache is bounded; an evicted entity is simply replayed on its next access.
 *
 * @param <T> entity type
 * @param <E> the entity's event type
 */
@Slf4j
public class EntityRepository<T extends EventSourcedEntity<E>, E extends EntityEvent> {

    public static final long DEFAULT_CACHE_SIZE = 10_000;

    private final String entityType;
    private final Class<E> eventType;
    private final Supplier<T> factory;
    private final EventStore eventStore;
    private final EntityRuntime runtime;
    private final Cache<EntityKey, T> cache;

    public EntityRepository(String entityType, Class<E> eventType, Supplier<T> factory,
                            EventStore eventStore, EntityRuntime runtime) {
        this(entityType, eventType, factory, eventStore, runtime,
            Caffeine.newBuilder().maximumSize(DEFAULT_CACHE_SIZE));
    }

    EntityRepository(String entityType, Class<E> eventType, Supplier<T> factory,
                     EventStore eventStore, EntityRuntime runtime, Caffeine<Object, Object> cacheBuilder) {
        this.entityType = entityType;
        this.eventType = eventType;
        this.factory = factory;
        this.eventStore = eventStore;
        this.runtime = runtime;
        this.cache = cacheBuilder.build();
    }

    public EntityKey keyFor(String organizationId, String entityId) {
        return EntityKey.of(entityType, organizationId, entityId);
    }

    /**
     * Runs a command against the entity and persists the events it raised.
     */
    public <R> R execute(String organizationId, String entityId, Function<T, R> command) {
        EntityKey key = keyFor(organizationId, entityId);
        return runtime.runExclusive(key, () -> {
            T entity = load(key);
            try {
                R result = command.apply(entity);
                List<E> events = entity.pendingEvents();
                if (!events.isEmpty()) {
                    eventStore.append(key, entity.getVersion(), events);
                    entity.markCommitted();
                    cache.put(key, entity);
                }
                return result;
            } catch (RuntimeException e) {
                cache.invalidate(key);
                throw e;
            }
        });
    }

    /**
     * Runs a read-only function against the entity. Nothing is persisted.
     */
    public <R> R query(String organizationId, String entityId, Function<T, R> query) {
        EntityKey key = keyFor(organizationId, entityId);
        return runtime.runExclusive(key, () -> query.apply(load(key)));
    }

    /**
     * Runs work while holding the entity's lock. Commands issued from inside it through
     * {@link #execute} reenter the same lock.
     */
    public <R> R exclusively(String organizationId, String entityId, Supplier<R> work) {
        return runtime.runExclusive(keyFor(organizationId, entityId), work);
    }

    /**
     * Rewrites the entity's stored history as {@code snapshot} and returns the rebuilt entity's
     * version. The snapshot events must rebuild the live state; an empty snapshot deletes the
     * entity.
     */
    public long compact(String organizationId, String entityId, Function<T, List<E>> snapshot) {
        EntityKey key = keyFor(organizationId, entityId);
        return runtime.runExclusive(key, () -> {
            T entity = load(key);
            try {
                List<E> events = snapshot.apply(entity);
                eventStore.replace(key, entity.getVersion(), events);
                T compacted = factory.get();
                compacted.replay(events);
                if (events.isEmpty()) {
                    cache.invalidate(key);
                } else {
                    cache.put(key, compacted);
                }
                log.debug("Compacted {} from {} to {} event(s)", key, entity.getVersion(), events.size());
                return compacted.getVersion();
            } catch (RuntimeException e) {
                cache.invalidate(key);
                throw e;
            }
        });
    }

    /**
     * Lists the keys of every stored entity of this type.
     */
    public List<EntityKey> storedKeys() {
        return eventStore.keys(entityType);
    }

    private T load(EntityKey key) {
        T cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        T entity = factory.get();
        List<E> history = eventStore.load(key, eventType);
        entity.replay(history);
        if (!history.isEmpty()) {
            cache.put(key, entity);
            log.debug("Rebuilt {} from {} event(s)", key, history.size());
        }
        return entity;
    }

    long cachedEntities() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
