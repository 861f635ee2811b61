package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable snapshot of one closed accounting month of an account.
 * Opening entries are not counted in the totals.
 */
@Value
public class PeriodSummary {
    int year;
    int month;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    BigDecimal closingBalance;
    int entryCount;
    String closedBy;
    Instant closedAt;
}
