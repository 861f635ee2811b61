package com.flagship.finance_ledger.period.event;

import lombok.Value;

import java.time.Instant;

@Value
public class PeriodOpenedEvent implements FiscalYearEvent {
    int periodNumber;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountingPeriodOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
