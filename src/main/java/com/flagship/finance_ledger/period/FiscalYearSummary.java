package com.flagship.finance_ledger.period;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class FiscalYearSummary {
    int year;
    PeriodFrequency frequency;
    int startMonth;
    LocalDate startDate;
    LocalDate endDate;
    int totalPeriods;
    int notStartedPeriods;
    int openPeriods;
    int closedPeriods;
    int lockedPeriods;
    Integer currentOpenPeriod;
    boolean yearClosed;
    Instant yearClosedAt;
    String yearClosedBy;
    String retainedEarningsAccountCode;
}
