package com.flagship.finance_ledger.period;

import com.flagship.finance_ledger.chart.ChartAccount;
import com.flagship.finance_ledger.chart.ChartOfAccounts;
import com.flagship.finance_ledger.ledger.AccountEntry;
import com.flagship.finance_ledger.ledger.AccountLedgerService;
import com.flagship.finance_ledger.ledger.BalanceSide;
import com.flagship.finance_ledger.ledger.EntryReference;
import com.flagship.finance_ledger.ledger.EntryType;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates year-end close across all accounts of an organization.
 *
 * This service:
 * 1. Checks every period of the fiscal year is closed and the year is still open
 * 2. Empties each active revenue and expense account into retained earnings, posting a
 *    closing entry on the account and the offsetting entry on retained earnings
 * 3. Locks the fiscal year through {@link AccountingPeriodService#yearEndClose}
 *
 * Closing postings carry reference type "YearEndClose" and a per-account reference
 * number, so a rerun after a partial failure posts only what is missing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class YearEndCloseService {

    public static final String REFERENCE_TYPE = "YearEndClose";

    private final AccountingPeriodService periodService;
    private final AccountLedgerService ledgerService;
    private final ChartOfAccounts chartOfAccounts;

    public YearEndCloseResult closeYear(UUID organizationId, int year, String retainedEarningsAccountCode,
                                        String performedBy) {
        MDC.put("fiscalYear", String.valueOf(year));
        try {
            FiscalYearSummary before = periodService.getSummary(organizationId, year);
            if (before.isYearClosed()) {
                throw new IllegalStateException(String.format("Fiscal year %d is already closed", year));
            }
            int unclosed = before.getNotStartedPeriods() + before.getOpenPeriods();
            if (unclosed > 0) {
                throw new IllegalStateException(String.format(
                    "Cannot close fiscal year %d: %d unclosed period(s)", year, unclosed));
            }

            ChartAccount retainedEarnings = chartOfAccounts.findAccount(organizationId, retainedEarningsAccountCode)
                .filter(ChartAccount::isActive)
                .orElseThrow(() -> new IllegalStateException(
                    "Retained earnings account not found or inactive: " + retainedEarningsAccountCode));
            if (!ledgerService.exists(organizationId, retainedEarnings.getAccountId())) {
                throw new IllegalStateException(
                    "Retained earnings account has no ledger: " + retainedEarningsAccountCode);
            }

            UUID closeReferenceId = UUID.nameUUIDFromBytes(
                ("year-end-close:" + organizationId + ":" + year).getBytes(StandardCharsets.UTF_8));

            List<ClosingPosting> postings = new ArrayList<>();
            BigDecimal netIncome = BigDecimal.ZERO;
            for (ChartAccount account : chartOfAccounts.getActiveAccounts(organizationId)) {
                if (!account.getAccountType().isTemporary()) {
                    continue;
                }
                Optional<ClosingPosting> posting = closeAccount(organizationId, year, account, retainedEarnings,
                    closeReferenceId, performedBy);
                if (posting.isPresent()) {
                    postings.add(posting.get());
                    // Retained earnings is credit-normal; a credit to it is income
                    netIncome = posting.get().getRetainedEarningsSide() == BalanceSide.CREDIT
                        ? netIncome.add(posting.get().getAmount())
                        : netIncome.subtract(posting.get().getAmount());
                }
            }

            FiscalYearSummary closed = periodService.yearEndClose(organizationId, year,
                retainedEarningsAccountCode, performedBy);
            log.info("Year-end close complete: {} account(s) closed, net income {}", postings.size(), netIncome);
            return new YearEndCloseResult(closed, postings, netIncome);
        } finally {
            MDC.remove("fiscalYear");
        }
    }

    private Optional<ClosingPosting> closeAccount(UUID organizationId, int year, ChartAccount account,
                                                  ChartAccount retainedEarnings, UUID closeReferenceId,
                                                  String performedBy) {
        if (!ledgerService.exists(organizationId, account.getAccountId())) {
            log.debug("Account {} has no ledger yet, nothing to close", account.getAccountCode());
            return Optional.empty();
        }
        String referenceNumber = String.format("YE-%d-%s", year, account.getAccountCode());
        EntryReference reference = EntryReference.of(REFERENCE_TYPE, closeReferenceId, referenceNumber);

        Optional<AccountEntry> closingEntry = findClosingEntry(organizationId, account.getAccountId(),
            closeReferenceId, referenceNumber);

        if (closingEntry.isEmpty()) {
            BigDecimal balance = ledgerService.getBalance(organizationId, account.getAccountId());
            if (balance.signum() == 0) {
                return Optional.empty();
            }
            // A positive balance sits on the normal side, so it is emptied from the other side
            BalanceSide normal = account.getAccountType().getNormalBalance();
            BalanceSide closingSide = balance.signum() > 0 ? normal.opposite() : normal;
            String description = String.format("Year-end close %d: %s to retained earnings", year, account.getName());
            post(organizationId, account.getAccountId(), closingSide, balance.abs(), description, performedBy, reference);
            closingEntry = findClosingEntry(organizationId, account.getAccountId(), closeReferenceId, referenceNumber);
        }

        AccountEntry entry = closingEntry.orElseThrow(() -> new IllegalStateException(
            "Closing entry missing after posting for account " + account.getAccountCode()));
        BalanceSide closingSide = entry.getEntryType() == EntryType.DEBIT ? BalanceSide.DEBIT : BalanceSide.CREDIT;
        BalanceSide retainedSide = closingSide.opposite();

        boolean counterpartPosted = findClosingEntry(organizationId, retainedEarnings.getAccountId(),
            closeReferenceId, referenceNumber).isPresent();
        if (!counterpartPosted) {
            String description = String.format("Year-end close %d: %s", year, account.getName());
            post(organizationId, retainedEarnings.getAccountId(), retainedSide, entry.getAmount(), description,
                performedBy, reference);
        } else {
            log.info("Retained earnings already received closing entry {}, skipping", referenceNumber);
        }

        return Optional.of(new ClosingPosting(account.getAccountCode(), closingSide, entry.getAmount(), retainedSide));
    }

    private Optional<AccountEntry> findClosingEntry(UUID organizationId, UUID accountId, UUID referenceId,
                                                    String referenceNumber) {
        return ledgerService.getEntriesByReference(organizationId, accountId, REFERENCE_TYPE, referenceId).stream()
            .filter(e -> referenceNumber.equals(e.getReferenceNumber()))
            .findFirst();
    }

    private void post(UUID organizationId, UUID accountId, BalanceSide side, BigDecimal amount, String description,
                      String performedBy, EntryReference reference) {
        if (side == BalanceSide.DEBIT) {
            ledgerService.postDebit(organizationId, accountId, amount, description, performedBy, reference);
        } else {
            ledgerService.postCredit(organizationId, accountId, amount, description, performedBy, reference);
        }
    }

    /**
     * Closing entry made for one revenue or expense account.
     */
    @Value
    public static class ClosingPosting {
        String accountCode;
        BalanceSide accountSide;
        BigDecimal amount;
        BalanceSide retainedEarningsSide;
    }

    @Value
    public static class YearEndCloseResult {
        FiscalYearSummary fiscalYear;
        List<ClosingPosting> postings;
        BigDecimal netIncome;
    }
}
