package com.flagship.finance_ledger.period.event;

import lombok.Value;

import java.time.Instant;

/**
 * Every period was locked and the fiscal year permanently closed.
 */
@Value
public class YearEndClosedEvent implements FiscalYearEvent {
    String retainedEarningsAccountCode;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FiscalYearClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
