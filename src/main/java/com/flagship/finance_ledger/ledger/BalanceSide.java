package com.flagship.finance_ledger.ledger;

/**
 * The two sides of a double-entry posting.
 */
public enum BalanceSide {
    DEBIT,
    CREDIT;

    public BalanceSide opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
