package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Account details together with its cumulative activity.
 * Totals include the opening entry.
 */
@Value
@Builder
public class AccountSummary {
    UUID accountId;
    String accountCode;
    String name;
    String description;
    AccountType accountType;
    BalanceSide normalBalance;
    String currency;
    BigDecimal balance;
    BigDecimal openingBalance;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    int totalEntryCount;
    boolean active;
    boolean systemAccount;
    int currentPeriodYear;
    int currentPeriodMonth;
    Instant createdAt;
    String createdBy;
    Instant lastModifiedAt;
    String lastModifiedBy;
}
