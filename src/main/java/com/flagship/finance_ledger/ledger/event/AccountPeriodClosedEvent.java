package com.flagship.finance_ledger.ledger.event;

import com.flagship.finance_ledger.ledger.PeriodSummary;
import lombok.Value;

import java.time.Instant;

@Value
public class AccountPeriodClosedEvent implements AccountLedgerEvent {
    PeriodSummary summary;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountPeriodClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
