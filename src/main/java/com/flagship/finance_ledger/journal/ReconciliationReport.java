package com.flagship.finance_ledger.journal;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Comparison of a journal entry's status and acknowledgements with what its accounts
 * actually recorded. A consistent report has no discrepancies and no posting left half done.
 */
@Value
public class ReconciliationReport {
    UUID entryId;
    JournalEntryStatus status;
    boolean partiallyPosted;
    List<Discrepancy> discrepancies;

    public boolean isConsistent() {
        return discrepancies.isEmpty() && !partiallyPosted;
    }

    public enum DiscrepancyType {
        LINE_NOT_POSTED,          // entry claims to be posted but the line has no acknowledgement
        MISSING_ACCOUNT_ENTRY,    // acknowledged, but the account has no such entry
        UNACKNOWLEDGED_POSTING,   // the account has an entry the journal never acknowledged
        AMOUNT_MISMATCH,
        UNKNOWN_ACCOUNT
    }

    @Value
    public static class Discrepancy {
        int lineNumber;
        String accountCode;
        DiscrepancyType type;
        String detail;
    }
}
