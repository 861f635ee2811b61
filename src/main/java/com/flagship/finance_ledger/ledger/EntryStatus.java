package com.flagship.finance_ledger.ledger;

public enum EntryStatus {
    POSTED,
    REVERSED
}
