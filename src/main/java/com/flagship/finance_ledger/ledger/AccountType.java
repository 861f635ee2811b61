package com.flagship.finance_ledger.ledger;

/**
 * Account classification. The type fixes the normal balance side: postings on the
 * normal side increase the balance, postings on the other side decrease it.
 */
public enum AccountType {
    ASSET(BalanceSide.DEBIT),
    LIABILITY(BalanceSide.CREDIT),
    EQUITY(BalanceSide.CREDIT),
    REVENUE(BalanceSide.CREDIT),
    EXPENSE(BalanceSide.DEBIT);

    private final BalanceSide normalBalance;

    AccountType(BalanceSide normalBalance) {
        this.normalBalance = normalBalance;
    }

    public BalanceSide getNormalBalance() {
        return normalBalance;
    }

    /**
     * Revenue and expense accounts are emptied into retained earnings at year end.
     */
    public boolean isTemporary() {
        return this == REVENUE || this == EXPENSE;
    }
}
