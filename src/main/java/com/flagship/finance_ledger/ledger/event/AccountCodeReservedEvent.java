package com.flagship.finance_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountCodeReservedEvent implements AccountCodeIndexEvent {
    String accountCode;
    UUID accountId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountCodeReserved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
