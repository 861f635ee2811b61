package com.flagship.finance_ledger.chart;

import com.flagship.finance_ledger.ledger.AccountType;
import lombok.Value;

import java.util.UUID;

/**
 * An entry of an organization's chart of accounts: the account code used on journal
 * lines, and the ledger account it maps to.
 */
@Value
public class ChartAccount {
    String accountCode;
    UUID accountId;
    String name;
    AccountType accountType;
    String parentCode;
    boolean active;
}
