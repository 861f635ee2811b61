package com.flagship.finance_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;

@Value
public class AccountUpdatedEvent implements AccountLedgerEvent {
    String name;
    String description;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
