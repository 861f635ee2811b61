package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.journal.event.JournalEntryApprovedEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryCreatedEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryRejectedEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryReversedEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryVoidedEvent;
import com.flagship.finance_ledger.journal.event.LinePostedEvent;
import com.flagship.finance_ledger.journal.event.PostingStartedEvent;
import com.flagship.finance_ledger.runtime.AlreadyExistsException;
import com.flagship.finance_ledger.runtime.EventSourcedEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * A multi-line balanced journal entry and its posting progress.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Debits equal credits from the moment the entry exists
 * - Posting is recorded line by line, so an interrupted posting can be resumed
 *   without sending any line to its account twice
 */
public class JournalEntry extends EventSourcedEntity<JournalEntryEvent> {

    private static final DateTimeFormatter ENTRY_NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private boolean initialized;
    private UUID entryId;
    private UUID organizationId;
    private String entryNumber;
    private LocalDate postingDate;
    private String memo;
    private String referenceType;
    private UUID referenceId;
    private String referenceNumber;
    private List<JournalLine> lines = List.of();
    private BigDecimal totalDebits = BigDecimal.ZERO;
    private BigDecimal totalCredits = BigDecimal.ZERO;
    private JournalEntryStatus status;
    private String createdBy;
    private Instant createdAt;
    private String approvedBy;
    private Instant approvedAt;
    private String postedBy;
    private Instant postedAt;
    private String voidedBy;
    private Instant voidedAt;
    private String voidReason;
    private String rejectedBy;
    private Instant rejectedAt;
    private String rejectionReason;
    private boolean postingStarted;
    private UUID reversalEntryId;
    private UUID reversalOfEntryId;
    private final Map<Integer, LinePosting> linePostings = new TreeMap<>();

    /**
     * Creates the entry in DRAFT status.
     *
     * @param accountValidator tells whether an account code is known and active
     * @throws IllegalArgumentException for malformed lines
     * @throws IllegalStateException if debits and credits differ or an account is invalid
     */
    public void create(UUID entryId, UUID organizationId, LocalDate postingDate, List<JournalLine> inputLines,
                       String memo, String referenceType, UUID referenceId, String referenceNumber,
                       UUID reversalOfEntryId, Predicate<String> accountValidator,
                       String performedBy, Instant now) {
        if (initialized) {
            throw new AlreadyExistsException("Journal entry already exists: " + entryId);
        }
        if (postingDate == null) {
            throw new IllegalArgumentException("Posting date is required");
        }
        if (inputLines == null || inputLines.size() < 2) {
            throw new IllegalArgumentException("Journal entry must have at least two lines");
        }

        List<JournalLine> numbered = new ArrayList<>(inputLines.size());
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        for (int i = 0; i < inputLines.size(); i++) {
            JournalLine line = inputLines.get(i).numbered(i + 1);
            validateLine(line);
            debits = debits.add(line.getDebitAmount());
            credits = credits.add(line.getCreditAmount());
            numbered.add(line);
        }

        if (debits.compareTo(credits) != 0) {
            throw new IllegalStateException(
                String.format("Debits (%s) must equal credits (%s)", debits, credits));
        }

        for (JournalLine line : numbered) {
            if (!accountValidator.test(line.getAccountCode())) {
                throw new IllegalStateException(String.format(
                    "Line %d: account %s is not an active account", line.getLineNumber(), line.getAccountCode()));
            }
        }

        String number = String.format("JE-%s-%s", postingDate.format(ENTRY_NUMBER_DATE),
            entryId.toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT));

        raise(new JournalEntryCreatedEvent(entryId, organizationId, number, postingDate, memo,
            referenceType, referenceId, referenceNumber, List.copyOf(numbered), reversalOfEntryId,
            performedBy, now));
    }

    public void approve(String performedBy, Instant now) {
        requireInitialized();
        if (status != JournalEntryStatus.DRAFT) {
            throw new IllegalStateException(String.format(
                "Cannot approve journal entry in %s status. Only DRAFT entries can be approved.", status));
        }
        raise(new JournalEntryApprovedEvent(performedBy, now));
    }

    public void reject(String reason, String performedBy, Instant now) {
        requireInitialized();
        if (status != JournalEntryStatus.DRAFT && status != JournalEntryStatus.APPROVED) {
            throw new IllegalStateException(String.format(
                "Cannot reject journal entry in %s status. Only DRAFT or APPROVED entries can be rejected.", status));
        }
        if (postingStarted) {
            throw new IllegalStateException("Cannot reject journal entry: posting has already started");
        }
        raise(new JournalEntryRejectedEvent(reason, performedBy, now));
    }

    /**
     * Starts (or resumes) posting.
     *
     * @return the lines not yet acknowledged, in line order
     */
    public List<JournalLine> beginPosting(String performedBy, Instant now) {
        requirePostable();
        if (!postingStarted) {
            raise(new PostingStartedEvent(performedBy, now));
        }
        return lines.stream()
            .filter(line -> !linePostings.containsKey(line.getLineNumber()))
            .toList();
    }

    public void acknowledgeLine(LinePosting posting, Instant now) {
        requirePostable();
        if (!postingStarted) {
            throw new IllegalStateException("Posting has not been started");
        }
        if (linePostings.containsKey(posting.getLineNumber())) {
            return;
        }
        if (posting.getLineNumber() < 1 || posting.getLineNumber() > lines.size()) {
            throw new IllegalArgumentException("No such line: " + posting.getLineNumber());
        }
        raise(new LinePostedEvent(posting, now));
    }

    public void completePosting(String performedBy, Instant now) {
        requirePostable();
        if (linePostings.size() != lines.size()) {
            throw new IllegalStateException(String.format(
                "Cannot complete posting: %d of %d lines acknowledged", linePostings.size(), lines.size()));
        }
        raise(new JournalEntryPostedEvent(performedBy, now));
    }

    public void voidEntry(String reason, String performedBy, Instant now) {
        requireInitialized();
        if (status == JournalEntryStatus.POSTED || status == JournalEntryStatus.REVERSED) {
            throw new IllegalStateException("Cannot void a Posted entry. Use reverse instead.");
        }
        if (status == JournalEntryStatus.VOIDED) {
            throw new IllegalStateException("Journal entry is already voided");
        }
        if (status == JournalEntryStatus.REJECTED) {
            throw new IllegalStateException("Cannot void a rejected journal entry");
        }
        if (postingStarted) {
            throw new IllegalStateException(String.format(
                "Cannot void journal entry: posting has started (%d of %d lines posted)",
                linePostings.size(), lines.size()));
        }
        raise(new JournalEntryVoidedEvent(reason, performedBy, now));
    }

    public void markReversed(UUID reversalId, String reason, String performedBy, Instant now) {
        requireInitialized();
        if (status == JournalEntryStatus.REVERSED) {
            throw new IllegalStateException("Journal entry has already been reversed");
        }
        if (status != JournalEntryStatus.POSTED) {
            throw new IllegalStateException(String.format(
                "Cannot reverse journal entry in %s status. Only POSTED entries can be reversed.", status));
        }
        raise(new JournalEntryReversedEvent(reversalId, reason, performedBy, now));
    }

    // ==================== Queries ====================

    public boolean exists() {
        return initialized;
    }

    public JournalEntryStatus getStatus() {
        requireInitialized();
        return status;
    }

    public List<JournalLine> getLines() {
        requireInitialized();
        return lines;
    }

    public JournalEntryView toView() {
        requireInitialized();
        return JournalEntryView.builder()
            .entryId(entryId)
            .organizationId(organizationId)
            .entryNumber(entryNumber)
            .postingDate(postingDate)
            .memo(memo)
            .referenceType(referenceType)
            .referenceId(referenceId)
            .referenceNumber(referenceNumber)
            .lines(lines)
            .totalDebits(totalDebits)
            .totalCredits(totalCredits)
            .status(status)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .approvedBy(approvedBy)
            .approvedAt(approvedAt)
            .postedBy(postedBy)
            .postedAt(postedAt)
            .voidedBy(voidedBy)
            .voidedAt(voidedAt)
            .voidReason(voidReason)
            .rejectedBy(rejectedBy)
            .rejectedAt(rejectedAt)
            .rejectionReason(rejectionReason)
            .postingStarted(postingStarted)
            .linePostings(List.copyOf(linePostings.values()))
            .reversalEntryId(reversalEntryId)
            .reversalOfEntryId(reversalOfEntryId)
            .build();
    }

    // ==================== Event application ====================

    @Override
    protected void apply(JournalEntryEvent event) {
        if (event instanceof JournalEntryCreatedEvent e) {
            initialized = true;
            entryId = e.getEntryId();
            organizationId = e.getOrganizationId();
            entryNumber = e.getEntryNumber();
            postingDate = e.getPostingDate();
            memo = e.getMemo();
            referenceType = e.getReferenceType();
            referenceId = e.getReferenceId();
            referenceNumber = e.getReferenceNumber();
            lines = List.copyOf(e.getLines());
            totalDebits = lines.stream().map(JournalLine::getDebitAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
            totalCredits = lines.stream().map(JournalLine::getCreditAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
            reversalOfEntryId = e.getReversalOfEntryId();
            status = JournalEntryStatus.DRAFT;
            createdBy = e.getPerformedBy();
            createdAt = e.getOccurredAt();
        } else if (event instanceof JournalEntryApprovedEvent e) {
            status = JournalEntryStatus.APPROVED;
            approvedBy = e.getPerformedBy();
            approvedAt = e.getOccurredAt();
        } else if (event instanceof JournalEntryRejectedEvent e) {
            status = JournalEntryStatus.REJECTED;
            rejectedBy = e.getPerformedBy();
            rejectedAt = e.getOccurredAt();
            rejectionReason = e.getReason();
        } else if (event instanceof PostingStartedEvent) {
            postingStarted = true;
        } else if (event instanceof LinePostedEvent e) {
            linePostings.put(e.getPosting().getLineNumber(), e.getPosting());
        } else if (event instanceof JournalEntryPostedEvent e) {
            status = JournalEntryStatus.POSTED;
            postedBy = e.getPerformedBy();
            postedAt = e.getOccurredAt();
        } else if (event instanceof JournalEntryVoidedEvent e) {
            status = JournalEntryStatus.VOIDED;
            voidedBy = e.getPerformedBy();
            voidedAt = e.getOccurredAt();
            voidReason = e.getReason();
        } else if (event instanceof JournalEntryReversedEvent e) {
            status = JournalEntryStatus.REVERSED;
            reversalEntryId = e.getReversalEntryId();
        }
    }

    // ==================== Helpers ====================

    private static void validateLine(JournalLine line) {
        if (line.getAccountCode() == null || line.getAccountCode().isBlank()) {
            throw new IllegalArgumentException(String.format("Line %d: account code is required", line.getLineNumber()));
        }
        BigDecimal debit = line.getDebitAmount();
        BigDecimal credit = line.getCreditAmount();
        if (debit == null || credit == null) {
            throw new IllegalArgumentException(String.format("Line %d: amounts are required", line.getLineNumber()));
        }
        if (debit.signum() < 0 || credit.signum() < 0) {
            throw new IllegalArgumentException(String.format("Line %d: amounts cannot be negative", line.getLineNumber()));
        }
        if (debit.signum() > 0 && credit.signum() > 0) {
            throw new IllegalArgumentException(String.format(
                "Line %d: a line cannot have both debit and credit amounts", line.getLineNumber()));
        }
        if (debit.signum() == 0 && credit.signum() == 0) {
            throw new IllegalArgumentException(String.format(
                "Line %d: a line must have either a debit or a credit amount", line.getLineNumber()));
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Journal entry not initialized");
        }
    }

    private void requirePostable() {
        requireInitialized();
        if (status != JournalEntryStatus.APPROVED) {
            throw new IllegalStateException(String.format(
                "Journal entry must be Approved to post (current: %s)", status));
        }
    }
}
