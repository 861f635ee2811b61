package com.flagship.finance_ledger.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;

/**
 * PostgreSQL-backed event store using JDBC directly.
 *
 * Events are stored as JSON in {@code entity_events}. The unique constraint on
 * (entity_type, organization_id, entity_id, sequence_number) is what detects a
 * concurrent writer: a second append at the same version fails with a duplicate key.
 */
@Slf4j
public class JdbcEventStore implements EventStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <E extends EntityEvent> List<E> load(EntityKey key, Class<E> eventType) {
        return jdbcTemplate.query(
            "SELECT payload FROM entity_events " +
            "WHERE entity_type = ? AND organization_id = ? AND entity_id = ? " +
            "ORDER BY sequence_number",
            (rs, rowNum) -> deserializePayload(rs.getString("payload"), eventType),
            key.getEntityType(),
            key.getOrganizationId(),
            key.getEntityId()
        );
    }

    @Override
    @Transactional
    public void append(EntityKey key, long expectedVersion, List<? extends EntityEvent> events) {
        long sequence = insertFrom(key, expectedVersion, events);
        log.debug("Appended {} event(s) to {}, version now {}", events.size(), key, sequence);
    }

    /**
     * Deletes the stream and writes {@code events} from sequence 1 in one transaction.
     * A deleted row count other than expectedVersion rolls the whole replacement back.
     */
    @Override
    @Transactional
    public void replace(EntityKey key, long expectedVersion, List<? extends EntityEvent> events) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM entity_events WHERE entity_type = ? AND organization_id = ? AND entity_id = ?",
            key.getEntityType(),
            key.getOrganizationId(),
            key.getEntityId()
        );
        if (deleted != expectedVersion) {
            log.warn("Version conflict compacting {}: expected {} event(s), found {}", key, expectedVersion, deleted);
            throw new ConcurrentEntityModificationException(key, expectedVersion, null);
        }
        insertFrom(key, 0, events);
        log.debug("Replaced {} event(s) of {} with {}", deleted, key, events.size());
    }

    @Override
    public List<EntityKey> keys(String entityType) {
        return jdbcTemplate.query(
            "SELECT DISTINCT organization_id, entity_id FROM entity_events WHERE entity_type = ?",
            (rs, rowNum) -> new EntityKey(entityType, rs.getString("organization_id"), rs.getString("entity_id")),
            entityType
        );
    }

    private long insertFrom(EntityKey key, long expectedVersion, List<? extends EntityEvent> events) {
        long sequence = expectedVersion;
        try {
            for (EntityEvent event : events) {
                sequence++;
                jdbcTemplate.update(
                    "INSERT INTO entity_events " +
                    "(entity_type, organization_id, entity_id, sequence_number, event_type, payload, occurred_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    key.getEntityType(),
                    key.getOrganizationId(),
                    key.getEntityId(),
                    sequence,
                    event.getEventType(),
                    serializePayload(event),
                    Timestamp.from(event.getOccurredAt())
                );
            }
        } catch (DuplicateKeyException e) {
            log.warn("Version conflict writing to {} at sequence {}", key, sequence);
            throw new ConcurrentEntityModificationException(key, expectedVersion, e);
        }
        return sequence;
    }

    private String serializePayload(EntityEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event: " + event.getEventType(), e);
        }
    }

    private <E> E deserializePayload(String payload, Class<E> eventType) {
        try {
            return objectMapper.readValue(payload, eventType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + eventType.getSimpleName() + " payload", e);
        }
    }
}
