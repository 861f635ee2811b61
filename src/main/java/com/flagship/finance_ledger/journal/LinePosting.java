package com.flagship.finance_ledger.journal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Acknowledgement that a journal line reached its account ledger.
 */
@Value
public class LinePosting {
    int lineNumber;
    UUID accountId;
    UUID accountEntryId;
    Instant postedAt;
}
