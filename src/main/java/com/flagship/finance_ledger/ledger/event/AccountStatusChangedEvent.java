package com.flagship.finance_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;

@Value
public class AccountStatusChangedEvent implements AccountLedgerEvent {
    boolean active;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
