package com.flagship.finance_ledger.ledger.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.finance_ledger.runtime.EntityEvent;

/**
 * Events of one account ledger. Entry history is rebuilt from these on load.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AccountCreatedEvent.class, name = AccountCreatedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = EntryPostedEvent.class, name = EntryPostedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = EntryReversedEvent.class, name = EntryReversedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = AccountPeriodClosedEvent.class, name = AccountPeriodClosedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = AccountStatusChangedEvent.class, name = AccountStatusChangedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = AccountUpdatedEvent.class, name = AccountUpdatedEvent.EVENT_TYPE)
})
public interface AccountLedgerEvent extends EntityEvent {

    String getPerformedBy();
}
