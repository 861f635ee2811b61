package com.flagship.finance_ledger.idempotency.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.finance_ledger.runtime.EntityEvent;

/**
 * Events of an organization's idempotency key store.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = KeyRegisteredEvent.class, name = KeyRegisteredEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = KeyUsedEvent.class, name = KeyUsedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = KeyStoreCompactedEvent.class, name = KeyStoreCompactedEvent.EVENT_TYPE)
})
public interface IdempotencyKeyEvent extends EntityEvent {
}
