package com.flagship.finance_ledger.period.event;

import com.flagship.finance_ledger.period.Period;
import com.flagship.finance_ledger.period.PeriodFrequency;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class FiscalYearInitializedEvent implements FiscalYearEvent {
    int year;
    PeriodFrequency frequency;
    int startMonth;
    List<Period> periods;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FiscalYearInitialized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
