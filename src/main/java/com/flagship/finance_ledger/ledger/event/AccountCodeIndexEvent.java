package com.flagship.finance_ledger.ledger.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.finance_ledger.runtime.EntityEvent;

/**
 * Events of an organization's account code index.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AccountCodeReservedEvent.class, name = AccountCodeReservedEvent.EVENT_TYPE)
})
public interface AccountCodeIndexEvent extends EntityEvent {
}
