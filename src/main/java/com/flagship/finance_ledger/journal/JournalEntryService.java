package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.chart.ChartAccount;
import com.flagship.finance_ledger.chart.ChartOfAccounts;
import com.flagship.finance_ledger.journal.event.JournalEntryEvent;
import com.flagship.finance_ledger.ledger.AccountEntry;
import com.flagship.finance_ledger.ledger.AccountLedgerService;
import com.flagship.finance_ledger.ledger.BalanceSide;
import com.flagship.finance_ledger.ledger.EntryReference;
import com.flagship.finance_ledger.ledger.EntryType;
import com.flagship.finance_ledger.ledger.PostingResult;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.period.AccountingPeriodService;
import com.flagship.finance_ledger.runtime.EntityRepository;
import com.flagship.finance_ledger.runtime.EntityRuntime;
import com.flagship.finance_ledger.runtime.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for the journal entry workflow: create, approve, post, void, reverse.
 *
 * Posting fans out to the account ledgers as a saga rather than a transaction:
 * 1. The entry records that posting started
 * 2. Each line is posted to its account, referencing the journal entry, and acknowledged
 * 3. When every line is acknowledged the entry becomes POSTED
 *
 * The journal entry's lock is held for the whole saga. If it is interrupted, calling
 * {@link #post} again resumes it: acknowledged lines are skipped, and a line whose account
 * already holds an entry with the line's reference is acknowledged without reposting.
 * {@link #reconcile} reports any disagreement between a journal entry and its accounts.
 */
@Service
@Slf4j
public class JournalEntryService {

    public static final String REFERENCE_TYPE = "JournalEntry";

    static final String ENTITY_TYPE = "JournalEntry";

    private final EntityRepository<JournalEntry, JournalEntryEvent> journals;
    private final AccountLedgerService ledgerService;
    private final AccountingPeriodService periodService;
    private final ChartOfAccounts chartOfAccounts;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public JournalEntryService(EventStore eventStore, EntityRuntime runtime, AccountLedgerService ledgerService,
                               AccountingPeriodService periodService, ChartOfAccounts chartOfAccounts,
                               Clock clock, LedgerMetrics metrics) {
        this.journals = new EntityRepository<>(ENTITY_TYPE, JournalEntryEvent.class,
            JournalEntry::new, eventStore, runtime);
        this.ledgerService = ledgerService;
        this.periodService = periodService;
        this.chartOfAccounts = chartOfAccounts;
        this.clock = clock;
        this.metrics = metrics;
    }

    public JournalEntryView create(UUID organizationId, UUID entryId, LocalDate postingDate, List<JournalLine> lines,
                                   String performedBy) {
        return create(organizationId, entryId, postingDate, lines, performedBy, null, null, null, null);
    }

    public JournalEntryView create(UUID organizationId, UUID entryId, LocalDate postingDate, List<JournalLine> lines,
                                   String performedBy, String memo, String referenceType, UUID referenceId,
                                   String referenceNumber) {
        return createEntry(organizationId, entryId, postingDate, lines, performedBy, memo,
            referenceType, referenceId, referenceNumber, null);
    }

    public JournalEntryView approve(UUID organizationId, UUID entryId, String performedBy) {
        JournalEntryView view = command(organizationId, entryId, entry -> {
            entry.approve(performedBy, now());
            return entry.toView();
        });
        logTransition(view, performedBy);
        return view;
    }

    public JournalEntryView reject(UUID organizationId, UUID entryId, String reason, String performedBy) {
        JournalEntryView view = command(organizationId, entryId, entry -> {
            entry.reject(reason, performedBy, now());
            return entry.toView();
        });
        logTransition(view, performedBy);
        return view;
    }

    /**
     * Posts every line to its account ledger, or resumes an interrupted posting.
     *
     * @throws IllegalStateException if the entry is not APPROVED, or the posting date is not
     *                               in an open period (checked only when posting first starts)
     */
    public JournalEntryView post(UUID organizationId, UUID entryId, String performedBy) {
        String org = requireOrganization(organizationId);
        return CorrelationContext.withContext(org, () -> journals.exclusively(org, requireId(entryId),
            () -> metrics.timeJournalPosting(() -> runPostingSaga(organizationId, entryId, performedBy))));
    }

    public JournalEntryView voidEntry(UUID organizationId, UUID entryId, String reason, String performedBy) {
        JournalEntryView view = command(organizationId, entryId, entry -> {
            entry.voidEntry(reason, performedBy, now());
            return entry.toView();
        });
        logTransition(view, performedBy);
        return view;
    }

    /**
     * Reverses a posted entry by creating, approving and posting a new entry with every
     * line's debit and credit exchanged. The reversing entry's id is derived from the
     * original's, so retrying a failed reversal continues the same reversing entry.
     *
     * @return the reversing entry
     */
    public JournalEntryView reverse(UUID organizationId, UUID entryId, LocalDate reversalDate, String reason,
                                    String performedBy) {
        String org = requireOrganization(organizationId);
        return CorrelationContext.withContext(org, () -> journals.exclusively(org, requireId(entryId), () -> {
            JournalEntryView original = get(organizationId, entryId);
            if (original.getStatus() == JournalEntryStatus.REVERSED) {
                throw new IllegalStateException("Journal entry has already been reversed");
            }
            if (original.getStatus() != JournalEntryStatus.POSTED) {
                throw new IllegalStateException(String.format(
                    "Cannot reverse journal entry in %s status. Only POSTED entries can be reversed.",
                    original.getStatus()));
            }

            UUID reversalId = reversalIdFor(entryId);
            LocalDate date = reversalDate != null ? reversalDate : original.getPostingDate();
            if (!exists(organizationId, reversalId)) {
                List<JournalLine> swapped = original.getLines().stream().map(JournalLine::swapped).toList();
                String memo = String.format("Reversal of %s%s", original.getEntryNumber(),
                    reason != null ? ": " + reason : "");
                createEntry(organizationId, reversalId, date, swapped, performedBy, memo,
                    REFERENCE_TYPE, entryId, original.getEntryNumber(), entryId);
            }
            if (getStatus(organizationId, reversalId) == JournalEntryStatus.DRAFT) {
                approve(organizationId, reversalId, performedBy);
            }
            JournalEntryView reversal = getStatus(organizationId, reversalId) == JournalEntryStatus.APPROVED
                ? post(organizationId, reversalId, performedBy)
                : get(organizationId, reversalId);

            JournalEntryView reversed = command(organizationId, entryId, entry -> {
                entry.markReversed(reversalId, reason, performedBy, now());
                return entry.toView();
            });
            logTransition(reversed, performedBy);
            return reversal;
        }));
    }

    /**
     * Compares the entry's acknowledged line postings with the entries its accounts hold.
     */
    public ReconciliationReport reconcile(UUID organizationId, UUID entryId) {
        JournalEntryView entry = get(organizationId, entryId);
        Map<Integer, LinePosting> acknowledged = entry.getLinePostings().stream()
            .collect(Collectors.toMap(LinePosting::getLineNumber, Function.identity()));
        boolean claimsPosted = entry.getStatus() == JournalEntryStatus.POSTED
            || entry.getStatus() == JournalEntryStatus.REVERSED;

        List<ReconciliationReport.Discrepancy> discrepancies = new ArrayList<>();
        for (JournalLine line : entry.getLines()) {
            Optional<ChartAccount> account = chartOfAccounts.findAccount(organizationId, line.getAccountCode());
            if (account.isEmpty()) {
                discrepancies.add(discrepancy(line, ReconciliationReport.DiscrepancyType.UNKNOWN_ACCOUNT,
                    "Account code no longer in chart of accounts"));
                continue;
            }
            Optional<AccountEntry> posted = findLineEntry(organizationId, account.get().getAccountId(), entry, line);
            LinePosting ack = acknowledged.get(line.getLineNumber());

            if (ack == null && posted.isPresent()) {
                discrepancies.add(discrepancy(line, ReconciliationReport.DiscrepancyType.UNACKNOWLEDGED_POSTING,
                    "Account entry " + posted.get().getEntryId() + " exists but was never acknowledged"));
            } else if (ack == null && claimsPosted) {
                discrepancies.add(discrepancy(line, ReconciliationReport.DiscrepancyType.LINE_NOT_POSTED,
                    "Entry is " + entry.getStatus() + " but the line has no posting"));
            } else if (ack != null && posted.isEmpty()) {
                discrepancies.add(discrepancy(line, ReconciliationReport.DiscrepancyType.MISSING_ACCOUNT_ENTRY,
                    "Acknowledged account entry " + ack.getAccountEntryId() + " not found on account"));
            } else if (posted.isPresent() && !matches(line, posted.get())) {
                discrepancies.add(discrepancy(line, ReconciliationReport.DiscrepancyType.AMOUNT_MISMATCH,
                    String.format("Line is %s %s, account entry is %s %s", line.side(), line.amount(),
                        posted.get().getEntryType(), posted.get().getAmount())));
            }
        }

        boolean partiallyPosted = entry.isPostingStarted() && !claimsPosted;
        if (!discrepancies.isEmpty() || partiallyPosted) {
            log.warn("Journal entry {} reconciliation: status={}, partiallyPosted={}, discrepancies={}",
                entry.getEntryNumber(), entry.getStatus(), partiallyPosted, discrepancies.size());
        }
        return new ReconciliationReport(entryId, entry.getStatus(), partiallyPosted, List.copyOf(discrepancies));
    }

    // ==================== Queries ====================

    public JournalEntryView get(UUID organizationId, UUID entryId) {
        return query(organizationId, entryId, JournalEntry::toView);
    }

    public boolean exists(UUID organizationId, UUID entryId) {
        return query(organizationId, entryId, JournalEntry::exists);
    }

    public JournalEntryStatus getStatus(UUID organizationId, UUID entryId) {
        return query(organizationId, entryId, JournalEntry::getStatus);
    }

    // ==================== Saga ====================

    private JournalEntryView runPostingSaga(UUID organizationId, UUID entryId, String performedBy) {
        JournalEntryView entry = get(organizationId, entryId);
        if (entry.getStatus() != JournalEntryStatus.APPROVED) {
            throw new IllegalStateException(String.format(
                "Journal entry must be Approved to post (current: %s)", entry.getStatus()));
        }
        if (!entry.isPostingStarted() && !periodService.canPostToDate(organizationId, entry.getPostingDate())) {
            throw new IllegalStateException(String.format(
                "Cannot post to date %s. Period may be closed.", entry.getPostingDate()));
        }
        if (entry.isPostingStarted()) {
            log.warn("Resuming interrupted posting of {}: {} of {} lines already posted",
                entry.getEntryNumber(), entry.getLinePostings().size(), entry.getLines().size());
        }

        List<JournalLine> pending = command(organizationId, entryId, j -> j.beginPosting(performedBy, now()));
        for (JournalLine line : pending) {
            LinePosting ack = postLine(organizationId, entry, line, performedBy);
            command(organizationId, entryId, j -> {
                j.acknowledgeLine(ack, now());
                return null;
            });
        }

        JournalEntryView posted = command(organizationId, entryId, j -> {
            j.completePosting(performedBy, now());
            return j.toView();
        });
        logTransition(posted, performedBy);
        return posted;
    }

    private LinePosting postLine(UUID organizationId, JournalEntryView entry, JournalLine line, String performedBy) {
        ChartAccount account = chartOfAccounts.findAccount(organizationId, line.getAccountCode())
            .orElseThrow(() -> new IllegalStateException(String.format(
                "Line %d: account %s is not in the chart of accounts", line.getLineNumber(), line.getAccountCode())));

        Optional<AccountEntry> existing = findLineEntry(organizationId, account.getAccountId(), entry, line);
        if (existing.isPresent()) {
            log.info("Line {} of {} already on account {}, acknowledging without reposting",
                line.getLineNumber(), entry.getEntryNumber(), line.getAccountCode());
            return new LinePosting(line.getLineNumber(), account.getAccountId(), existing.get().getEntryId(), now());
        }

        EntryReference reference = EntryReference.of(REFERENCE_TYPE, entry.getEntryId(),
            lineReference(entry, line));
        String description = line.getDescription() != null ? line.getDescription() : entry.getMemo();
        PostingResult result = line.side() == BalanceSide.DEBIT
            ? ledgerService.postDebit(organizationId, account.getAccountId(), line.amount(), description,
                performedBy, reference)
            : ledgerService.postCredit(organizationId, account.getAccountId(), line.amount(), description,
                performedBy, reference);
        return new LinePosting(line.getLineNumber(), account.getAccountId(), result.getEntryId(), now());
    }

    private Optional<AccountEntry> findLineEntry(UUID organizationId, UUID accountId, JournalEntryView entry,
                                                 JournalLine line) {
        if (!ledgerService.exists(organizationId, accountId)) {
            return Optional.empty();
        }
        String referenceNumber = lineReference(entry, line);
        return ledgerService.getEntriesByReference(organizationId, accountId, REFERENCE_TYPE, entry.getEntryId())
            .stream()
            .filter(e -> referenceNumber.equals(e.getReferenceNumber()))
            .findFirst();
    }

    // ==================== Helpers ====================

    private JournalEntryView createEntry(UUID organizationId, UUID entryId, LocalDate postingDate,
                                         List<JournalLine> lines, String performedBy, String memo,
                                         String referenceType, UUID referenceId, String referenceNumber,
                                         UUID reversalOfEntryId) {
        JournalEntryView view = command(organizationId, entryId, entry -> {
            entry.create(entryId, organizationId, postingDate, lines, memo, referenceType, referenceId,
                referenceNumber, reversalOfEntryId,
                code -> chartOfAccounts.validateAccount(organizationId, code), performedBy, now());
            return entry.toView();
        });
        log.info("Journal entry {} created with {} lines, total {}", view.getEntryNumber(), view.getLines().size(),
            view.getTotalDebits());
        metrics.recordJournalTransition(view.getStatus().name());
        return view;
    }

    private static String lineReference(JournalEntryView entry, JournalLine line) {
        return entry.getEntryNumber() + "#" + line.getLineNumber();
    }

    private static boolean matches(JournalLine line, AccountEntry accountEntry) {
        EntryType expected = line.side() == BalanceSide.DEBIT ? EntryType.DEBIT : EntryType.CREDIT;
        return accountEntry.getEntryType() == expected && accountEntry.getAmount().compareTo(line.amount()) == 0;
    }

    private static ReconciliationReport.Discrepancy discrepancy(JournalLine line,
                                                                ReconciliationReport.DiscrepancyType type,
                                                                String detail) {
        return new ReconciliationReport.Discrepancy(line.getLineNumber(), line.getAccountCode(), type, detail);
    }

    static UUID reversalIdFor(UUID entryId) {
        return UUID.nameUUIDFromBytes(("journal-reversal:" + entryId).getBytes(StandardCharsets.UTF_8));
    }

    private void logTransition(JournalEntryView view, String performedBy) {
        log.info("Journal entry {} is now {} (by {})", view.getEntryNumber(), view.getStatus(), performedBy);
        metrics.recordJournalTransition(view.getStatus().name());
    }

    private <R> R command(UUID organizationId, UUID entryId, Function<JournalEntry, R> command) {
        String org = requireOrganization(organizationId);
        return CorrelationContext.withContext(org, () -> journals.execute(org, requireId(entryId), command));
    }

    private <R> R query(UUID organizationId, UUID entryId, Function<JournalEntry, R> query) {
        return journals.query(requireOrganization(organizationId), requireId(entryId), query);
    }

    private Instant now() {
        return clock.instant();
    }

    private static String requireOrganization(UUID organizationId) {
        if (organizationId == null) {
            throw new IllegalArgumentException("Organization ID is required");
        }
        return organizationId.toString();
    }

    private static String requireId(UUID entryId) {
        if (entryId == null) {
            throw new IllegalArgumentException("Journal entry ID is required");
        }
        return entryId.toString();
    }
}
