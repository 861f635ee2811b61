package com.flagship.finance_ledger.period;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One accounting period of a fiscal year. Transitions return new instances.
 */
@Value
public class Period {
    int number;
    String name;
    LocalDate startDate;
    LocalDate endDate;
    PeriodStatus status;
    String openedBy;
    Instant openedAt;
    String closedBy;
    Instant closedAt;
    String lockedBy;
    Instant lockedAt;
    String notes;

    static Period notStarted(int number, String name, LocalDate startDate, LocalDate endDate) {
        return new Period(number, name, startDate, endDate, PeriodStatus.NOT_STARTED,
            null, null, null, null, null, null, null);
    }

    Period open(String performedBy, Instant at, String reopenReason) {
        return new Period(number, name, startDate, endDate, PeriodStatus.OPEN,
            performedBy, at, closedBy, closedAt, lockedBy, lockedAt, reopenReason != null ? reopenReason : notes);
    }

    Period close(String performedBy, Instant at) {
        return new Period(number, name, startDate, endDate, PeriodStatus.CLOSED,
            openedBy, openedAt, performedBy, at, lockedBy, lockedAt, notes);
    }

    Period lock(String performedBy, Instant at) {
        return new Period(number, name, startDate, endDate, PeriodStatus.LOCKED,
            openedBy, openedAt, closedBy, closedAt, performedBy, at, notes);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    boolean closedOrLocked() {
        return status == PeriodStatus.CLOSED || status == PeriodStatus.LOCKED;
    }
}
