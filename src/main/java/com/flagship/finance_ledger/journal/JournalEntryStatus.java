package com.flagship.finance_ledger.journal;

/**
 * Journal entry lifecycle.
 *
 * DRAFT -> APPROVED -> POSTED -> REVERSED, with DRAFT/APPROVED -> VOIDED or REJECTED.
 * Posting reaches the account ledgers, so POSTED can only be undone by reversal.
 */
public enum JournalEntryStatus {
    DRAFT,
    APPROVED,
    POSTED,
    VOIDED,
    REJECTED,
    REVERSED
}
