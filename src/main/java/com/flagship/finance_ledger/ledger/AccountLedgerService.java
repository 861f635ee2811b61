package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.ledger.event.AccountCodeIndexEvent;
import com.flagship.finance_ledger.ledger.event.AccountLedgerEvent;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.runtime.EntityRepository;
import com.flagship.finance_ledger.runtime.EntityRuntime;
import com.flagship.finance_ledger.runtime.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Command and query entry point for account ledgers, addressed by organization and account id.
 *
 * Each call runs under the account's lock, so postings to one account are applied one at a
 * time in arrival order while different accounts are posted in parallel.
 *
 * Account codes are unique per organization. Creation holds the organization's code index
 * lock around the account's own lock, and nothing takes them in the other order.
 */
@Service
@Slf4j
public class AccountLedgerService {

    public static final int DEFAULT_RECENT_ENTRIES = 50;

    static final String ENTITY_TYPE = "AccountLedger";
    static final String CODE_INDEX_ENTITY_TYPE = "AccountCodeIndex";

    private final EntityRepository<AccountLedger, AccountLedgerEvent> ledgers;
    private final EntityRepository<AccountCodeIndex, AccountCodeIndexEvent> codeIndexes;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public AccountLedgerService(EventStore eventStore, EntityRuntime runtime, Clock clock, LedgerMetrics metrics) {
        this.ledgers = new EntityRepository<>(ENTITY_TYPE, AccountLedgerEvent.class,
            AccountLedger::new, eventStore, runtime);
        this.codeIndexes = new EntityRepository<>(CODE_INDEX_ENTITY_TYPE, AccountCodeIndexEvent.class,
            AccountCodeIndex::new, eventStore, runtime);
        this.clock = clock;
        this.metrics = metrics;
    }

    public AccountSummary createAccount(UUID organizationId, UUID accountId, String accountCode, String name,
                                        AccountType accountType, String currency, BigDecimal openingBalance,
                                        boolean systemAccount, String performedBy) {
        return createAccount(organizationId, accountId, accountCode, name, null, accountType, currency,
            openingBalance, systemAccount, performedBy);
    }

    public AccountSummary createAccount(UUID organizationId, UUID accountId, String accountCode, String name,
                                        String description, AccountType accountType, String currency,
                                        BigDecimal openingBalance, boolean systemAccount, String performedBy) {
        String org = requireOrganization(organizationId);
        AccountSummary summary = codeIndexes.exclusively(org, org, () -> {
            if (accountCode != null) {
                codeIndexes.query(org, org, index -> {
                    index.requireAvailable(accountCode, accountId);
                    return null;
                });
            }
            AccountSummary created = command(organizationId, accountId, ledger -> {
                ledger.create(accountId, accountCode, name, description, accountType, currency, openingBalance,
                    systemAccount, performedBy, now());
                return ledger.getSummary();
            });
            codeIndexes.execute(org, org, index -> {
                index.reserve(accountCode, accountId, now());
                return null;
            });
            return created;
        });
        log.info("Account created: code={}, type={}, openingBalance={}, currency={}",
            accountCode, accountType, summary.getOpeningBalance(), summary.getCurrency());
        return summary;
    }

    public PostingResult postDebit(UUID organizationId, UUID accountId, BigDecimal amount, String description,
                                   String performedBy) {
        return postDebit(organizationId, accountId, amount, description, performedBy, null);
    }

    public PostingResult postDebit(UUID organizationId, UUID accountId, BigDecimal amount, String description,
                                   String performedBy, EntryReference reference) {
        PostingResult result = command(organizationId, accountId,
            ledger -> ledger.postDebit(amount, description, performedBy, reference, now()));
        recordPosting(accountId, result);
        return result;
    }

    public PostingResult postCredit(UUID organizationId, UUID accountId, BigDecimal amount, String description,
                                    String performedBy) {
        return postCredit(organizationId, accountId, amount, description, performedBy, null);
    }

    public PostingResult postCredit(UUID organizationId, UUID accountId, BigDecimal amount, String description,
                                    String performedBy, EntryReference reference) {
        PostingResult result = command(organizationId, accountId,
            ledger -> ledger.postCredit(amount, description, performedBy, reference, now()));
        recordPosting(accountId, result);
        return result;
    }

    public PostingResult adjustBalance(UUID organizationId, UUID accountId, BigDecimal newBalance, String reason,
                                       String performedBy) {
        PostingResult result = command(organizationId, accountId,
            ledger -> ledger.adjustBalance(newBalance, reason, performedBy, now()));
        log.info("Account {} adjusted from {} to {}: {}", accountId, result.getPreviousBalance(),
            result.getNewBalance(), reason);
        metrics.recordPosting(EntryType.ADJUSTMENT.name());
        return result;
    }

    public ReversalResult reverseEntry(UUID organizationId, UUID accountId, UUID entryId, String reason,
                                       String performedBy) {
        ReversalResult result = command(organizationId, accountId,
            ledger -> ledger.reverseEntry(entryId, reason, performedBy, now()));
        log.info("Entry {} on account {} reversed by {}, balance {} -> {}", entryId, accountId,
            result.getReversalEntryId(), result.getPreviousBalance(), result.getNewBalance());
        metrics.incrementReversals();
        return result;
    }

    public PeriodSummary closePeriod(UUID organizationId, UUID accountId, int year, int month, String performedBy) {
        PeriodSummary summary = command(organizationId, accountId,
            ledger -> ledger.closePeriod(year, month, performedBy, now()));
        log.info("Account {} closed period {}-{}: debits={}, credits={}, closing={}", accountId, year, month,
            summary.getTotalDebits(), summary.getTotalCredits(), summary.getClosingBalance());
        return summary;
    }

    public void deactivate(UUID organizationId, UUID accountId, String performedBy) {
        command(organizationId, accountId, ledger -> {
            ledger.deactivate(performedBy, now());
            return null;
        });
        log.info("Account {} deactivated by {}", accountId, performedBy);
    }

    public void activate(UUID organizationId, UUID accountId, String performedBy) {
        command(organizationId, accountId, ledger -> {
            ledger.activate(performedBy, now());
            return null;
        });
        log.info("Account {} activated by {}", accountId, performedBy);
    }

    public AccountSummary update(UUID organizationId, UUID accountId, String name, String description,
                                 String performedBy) {
        return command(organizationId, accountId, ledger -> {
            ledger.update(name, description, performedBy, now());
            return ledger.getSummary();
        });
    }

    // ==================== Queries ====================

    public boolean exists(UUID organizationId, UUID accountId) {
        return query(organizationId, accountId, AccountLedger::exists);
    }

    public Optional<UUID> findAccountId(UUID organizationId, String accountCode) {
        String org = requireOrganization(organizationId);
        return codeIndexes.query(org, org, index -> index.findAccountId(accountCode));
    }

    public BigDecimal getBalance(UUID organizationId, UUID accountId) {
        return query(organizationId, accountId, AccountLedger::getBalance);
    }

    public BigDecimal getBalanceAt(UUID organizationId, UUID accountId, Instant cutoff) {
        return query(organizationId, accountId, ledger -> ledger.getBalanceAt(cutoff));
    }

    public List<AccountEntry> getEntriesInRange(UUID organizationId, UUID accountId, Instant from, Instant to) {
        return query(organizationId, accountId, ledger -> ledger.getEntriesInRange(from, to));
    }

    public List<AccountEntry> getEntriesByReference(UUID organizationId, UUID accountId,
                                                    String referenceType, UUID referenceId) {
        return query(organizationId, accountId, ledger -> ledger.getEntriesByReference(referenceType, referenceId));
    }

    public List<AccountEntry> getRecentEntries(UUID organizationId, UUID accountId) {
        return getRecentEntries(organizationId, accountId, DEFAULT_RECENT_ENTRIES);
    }

    public List<AccountEntry> getRecentEntries(UUID organizationId, UUID accountId, int limit) {
        return query(organizationId, accountId, ledger -> ledger.getRecentEntries(limit));
    }

    public Optional<AccountEntry> getEntry(UUID organizationId, UUID accountId, UUID entryId) {
        return query(organizationId, accountId, ledger -> ledger.getEntry(entryId));
    }

    public List<PeriodSummary> getPeriodSummaries(UUID organizationId, UUID accountId) {
        return query(organizationId, accountId, AccountLedger::getPeriodSummaries);
    }

    public AccountSummary getSummary(UUID organizationId, UUID accountId) {
        return query(organizationId, accountId, AccountLedger::getSummary);
    }

    // ==================== Helpers ====================

    private <R> R command(UUID organizationId, UUID accountId, Function<AccountLedger, R> command) {
        String org = requireOrganization(organizationId);
        return CorrelationContext.withContext(org, () -> ledgers.execute(org, requireId(accountId), command));
    }

    private <R> R query(UUID organizationId, UUID accountId, Function<AccountLedger, R> query) {
        return ledgers.query(requireOrganization(organizationId), requireId(accountId), query);
    }

    private void recordPosting(UUID accountId, PostingResult result) {
        log.debug("Posted {} {} to account {}: balance {} -> {}", result.getEntryType(), result.getAmount(),
            accountId, result.getPreviousBalance(), result.getNewBalance());
        metrics.recordPosting(result.getEntryType().name());
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

    private static String requireId(UUID accountId) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account ID is required");
        }
        return accountId.toString();
    }
}
