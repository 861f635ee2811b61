package com.flagship.finance_ledger.period.event;

import lombok.Value;

import java.time.Instant;

@Value
public class PeriodReopenedEvent implements FiscalYearEvent {
    int periodNumber;
    String reason;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountingPeriodReopened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
