package com.flagship.finance_ledger.period.event;

import lombok.Value;

import java.time.Instant;

@Value
public class PeriodClosedEvent implements FiscalYearEvent {
    int periodNumber;
    boolean forced;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountingPeriodClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
