package com.flagship.finance_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only snapshot of a journal entry.
 */
@Value
@Builder
public class JournalEntryView {
    UUID entryId;
    UUID organizationId;
    String entryNumber;
    LocalDate postingDate;
    String memo;
    String referenceType;
    UUID referenceId;
    String referenceNumber;
    List<JournalLine> lines;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    JournalEntryStatus status;
    String createdBy;
    Instant createdAt;
    String approvedBy;
    Instant approvedAt;
    String postedBy;
    Instant postedAt;
    String voidedBy;
    Instant voidedAt;
    String voidReason;
    String rejectedBy;
    Instant rejectedAt;
    String rejectionReason;
    boolean postingStarted;
    List<LinePosting> linePostings;
    UUID reversalEntryId;
    UUID reversalOfEntryId;
}
