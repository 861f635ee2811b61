package com.flagship.finance_ledger.ledger;

/**
 * Represents the type of an account entry.
 */
public enum EntryType {
    DEBIT,
    CREDIT,
    ADJUSTMENT,
    OPENING,
    REVERSAL
}
