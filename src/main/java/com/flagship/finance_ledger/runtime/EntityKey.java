package com.flagship.finance_ledger.runtime;

import lombok.Value;

/**
 * Stable identity of an addressable entity: its type, the owning organization and its id.
 * All commands for one key are executed one at a time by {@link EntityRuntime}.
 */
@Value
public class EntityKey {
    String entityType;
    String organizationId;
    String entityId;

    public static EntityKey of(String entityType, String organizationId, String entityId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("Organization ID is required");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity ID is required");
        }
        return new EntityKey(entityType, organizationId, entityId);
    }

    @Override
    public String toString() {
        return entityType + "/" + organizationId + "/" + entityId;
    }
}
