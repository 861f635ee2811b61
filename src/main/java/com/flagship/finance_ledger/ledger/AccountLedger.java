package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.ledger.event.AccountCreatedEvent;
import com.flagship.finance_ledger.ledger.event.AccountLedgerEvent;
import com.flagship.finance_ledger.ledger.event.AccountPeriodClosedEvent;
import com.flagship.finance_ledger.ledger.event.AccountStatusChangedEvent;
import com.flagship.finance_ledger.ledger.event.AccountUpdatedEvent;
import com.flagship.finance_ledger.ledger.event.EntryPostedEvent;
import com.flagship.finance_ledger.ledger.event.EntryReversedEvent;
import com.flagship.finance_ledger.runtime.AlreadyExistsException;
import com.flagship.finance_ledger.runtime.EventSourcedEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Balance and entry history of one account.
 *
 * This entity enforces the core invariants:
 * 1. balance == openingBalance + sum of the effects of all non-opening entries
 * 2. A posting on the account's normal side increases the balance, the other side decreases it
 * 3. Entries are immutable except for being marked reversed; a reversal is never reversed
 * 4. Monthly periods close in order and each closes once
 */
public class AccountLedger extends EventSourcedEntity<AccountLedgerEvent> {

    public static final String DEFAULT_CURRENCY = "USD";

    private boolean initialized;
    private UUID accountId;
    private String accountCode;
    private String name;
    private String description;
    private AccountType accountType;
    private String currency;
    private BigDecimal openingBalance = BigDecimal.ZERO;
    private BigDecimal balance = BigDecimal.ZERO;
    private BigDecimal totalDebits = BigDecimal.ZERO;
    private BigDecimal totalCredits = BigDecimal.ZERO;
    private boolean active;
    private boolean systemAccount;
    private YearMonth currentPeriod;
    private Instant createdAt;
    private String createdBy;
    private Instant lastModifiedAt;
    private String lastModifiedBy;

    private final Map<UUID, AccountEntry> entries = new LinkedHashMap<>();
    private final List<PeriodSummary> periodSummaries = new ArrayList<>();

    // ==================== Commands ====================

    public void create(UUID accountId, String accountCode, String name, String description, AccountType accountType,
                       String currency, BigDecimal openingBalance, boolean systemAccount,
                       String performedBy, Instant now) {
        if (initialized) {
            throw new AlreadyExistsException("Account already exists");
        }
        if (accountCode == null || accountCode.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (accountType == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        String resolvedCurrency = resolveCurrency(currency);
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;
        YearMonth period = YearMonth.from(now.atZone(ZoneOffset.UTC));

        raise(new AccountCreatedEvent(accountId, accountCode, name, description, accountType, resolvedCurrency,
            opening, systemAccount, period.getYear(), period.getMonthValue(), performedBy, now));

        if (opening.signum() != 0) {
            AccountEntry openingEntry = newEntry(EntryType.OPENING, opening.abs(), opening,
                "Opening balance", performedBy, now, null).build();
            raise(new EntryPostedEvent(openingEntry, performedBy, now));
        }
    }

    public PostingResult postDebit(BigDecimal amount, String description, String performedBy,
                                   EntryReference reference, Instant now) {
        return post(BalanceSide.DEBIT, amount, description, performedBy, reference, now);
    }

    public PostingResult postCredit(BigDecimal amount, String description, String performedBy,
                                    EntryReference reference, Instant now) {
        return post(BalanceSide.CREDIT, amount, description, performedBy, reference, now);
    }

    /**
     * Sets the balance directly, recording the difference as an adjustment entry.
     */
    public PostingResult adjustBalance(BigDecimal newBalance, String reason, String performedBy, Instant now) {
        requireActive();
        if (newBalance == null) {
            throw new IllegalArgumentException("New balance is required");
        }
        if (newBalance.compareTo(balance) == 0) {
            throw new IllegalStateException("New balance is the same as current balance");
        }
        BigDecimal previous = balance;
        BigDecimal delta = newBalance.subtract(balance);
        AccountEntry entry = newEntry(EntryType.ADJUSTMENT, delta.abs(), delta,
            reason, performedBy, now, null).build();
        raise(new EntryPostedEvent(entry, performedBy, now));
        return PostingResult.of(entry, previous);
    }

    /**
     * Appends an entry that exactly cancels the effect of {@code entryId}.
     */
    public ReversalResult reverseEntry(UUID entryId, String reason, String performedBy, Instant now) {
        requireActive();
        AccountEntry original = entries.get(entryId);
        if (original == null) {
            throw new IllegalArgumentException("Entry not found: " + entryId);
        }
        if (original.getStatus() == EntryStatus.REVERSED) {
            throw new IllegalStateException("Entry has already been reversed");
        }
        if (original.getEntryType() == EntryType.REVERSAL) {
            throw new IllegalStateException("Cannot reverse a reversal entry");
        }
        BigDecimal previous = balance;
        String description = reason != null && !reason.isBlank()
            ? reason
            : "Reversal of entry " + entryId;
        AccountEntry reversal = newEntry(EntryType.REVERSAL, original.getAmount(), original.getEffect().negate(),
                description, performedBy, now, null)
            .reversedEntryId(entryId)
            .build();
        raise(new EntryReversedEvent(entryId, reversal, reason, performedBy, now));
        return new ReversalResult(reversal.getEntryId(), entryId, original.getAmount(), previous, balance);
    }

    /**
     * Closes the current accounting month and moves the period pointer to the next month.
     */
    public PeriodSummary closePeriod(int year, int month, String performedBy, Instant now) {
        requireInitialized();
        YearMonth requested = YearMonth.of(year, month);
        boolean alreadyClosed = periodSummaries.stream()
            .anyMatch(s -> s.getYear() == year && s.getMonth() == month);
        if (alreadyClosed) {
            throw new IllegalStateException(String.format("Period %s is already closed", requested));
        }
        if (!requested.equals(currentPeriod)) {
            throw new IllegalStateException(String.format(
                "Cannot close period %s: current open period is %s", requested, currentPeriod));
        }

        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        int count = 0;
        for (AccountEntry entry : entries.values()) {
            if (entry.getEntryType() == EntryType.OPENING
                    || entry.getPeriodYear() != year || entry.getPeriodMonth() != month) {
                continue;
            }
            if (sideOf(entry) == BalanceSide.DEBIT) {
                debits = debits.add(entry.getAmount());
            } else {
                credits = credits.add(entry.getAmount());
            }
            count++;
        }

        PeriodSummary summary = new PeriodSummary(year, month, debits, credits, balance, count, performedBy, now);
        raise(new AccountPeriodClosedEvent(summary, performedBy, now));
        return summary;
    }

    public void deactivate(String performedBy, Instant now) {
        requireInitialized();
        if (systemAccount) {
            throw new IllegalStateException("System accounts cannot be deactivated");
        }
        if (!active) {
            throw new IllegalStateException("Account is already inactive");
        }
        raise(new AccountStatusChangedEvent(false, performedBy, now));
    }

    public void activate(String performedBy, Instant now) {
        requireInitialized();
        if (active) {
            throw new IllegalStateException("Account is already active");
        }
        raise(new AccountStatusChangedEvent(true, performedBy, now));
    }

    public void update(String newName, String newDescription, String performedBy, Instant now) {
        requireInitialized();
        if (newName != null && newName.isBlank()) {
            throw new IllegalArgumentException("Account name cannot be blank");
        }
        raise(new AccountUpdatedEvent(newName != null ? newName : name,
            newDescription != null ? newDescription : description, performedBy, now));
    }

    // ==================== Queries ====================

    public boolean exists() {
        return initialized;
    }

    public BigDecimal getBalance() {
        requireInitialized();
        return balance;
    }

    /**
     * Balance as of {@code cutoff}, replaying every entry with timestamp at or before it.
     */
    public BigDecimal getBalanceAt(Instant cutoff) {
        requireInitialized();
        BigDecimal replayed = BigDecimal.ZERO;
        for (AccountEntry entry : entries.values()) {
            if (!entry.getTimestamp().isAfter(cutoff)) {
                replayed = replayed.add(entry.getEffect());
            }
        }
        return replayed;
    }

    public List<AccountEntry> getEntriesInRange(Instant from, Instant to) {
        requireInitialized();
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start must not be after range end");
        }
        return entries.values().stream()
            .filter(e -> !e.getTimestamp().isBefore(from) && !e.getTimestamp().isAfter(to))
            .toList();
    }

    public List<AccountEntry> getEntriesByReference(String referenceType, UUID referenceId) {
        requireInitialized();
        return entries.values().stream()
            .filter(e -> e.matchesReference(referenceType, referenceId))
            .toList();
    }

    /**
     * Newest entries first.
     */
    public List<AccountEntry> getRecentEntries(int limit) {
        requireInitialized();
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        List<AccountEntry> all = new ArrayList<>(entries.values());
        Collections.reverse(all);
        return all.subList(0, Math.min(limit, all.size()));
    }

    public Optional<AccountEntry> getEntry(UUID entryId) {
        requireInitialized();
        return Optional.ofNullable(entries.get(entryId));
    }

    public List<PeriodSummary> getPeriodSummaries() {
        requireInitialized();
        return periodSummaries.stream()
            .sorted(Comparator.comparing(PeriodSummary::getYear).thenComparing(PeriodSummary::getMonth))
            .toList();
    }

    public AccountSummary getSummary() {
        requireInitialized();
        return AccountSummary.builder()
            .accountId(accountId)
            .accountCode(accountCode)
            .name(name)
            .description(description)
            .accountType(accountType)
            .normalBalance(accountType.getNormalBalance())
            .currency(currency)
            .balance(balance)
            .openingBalance(openingBalance)
            .totalDebits(totalDebits)
            .totalCredits(totalCredits)
            .totalEntryCount(entries.size())
            .active(active)
            .systemAccount(systemAccount)
            .currentPeriodYear(currentPeriod.getYear())
            .currentPeriodMonth(currentPeriod.getMonthValue())
            .createdAt(createdAt)
            .createdBy(createdBy)
            .lastModifiedAt(lastModifiedAt)
            .lastModifiedBy(lastModifiedBy)
            .build();
    }

    public AccountType getAccountType() {
        requireInitialized();
        return accountType;
    }

    // ==================== Event application ====================

    @Override
    protected void apply(AccountLedgerEvent event) {
        if (event instanceof AccountCreatedEvent e) {
            initialized = true;
            accountId = e.getAccountId();
            accountCode = e.getAccountCode();
            name = e.getName();
            description = e.getDescription();
            accountType = e.getAccountType();
            currency = e.getCurrency();
            openingBalance = e.getOpeningBalance();
            systemAccount = e.isSystemAccount();
            active = true;
            currentPeriod = YearMonth.of(e.getPeriodYear(), e.getPeriodMonth());
            createdAt = e.getOccurredAt();
            createdBy = e.getPerformedBy();
        } else if (event instanceof EntryPostedEvent e) {
            record(e.getEntry());
        } else if (event instanceof EntryReversedEvent e) {
            AccountEntry original = entries.get(e.getReversedEntryId());
            entries.put(original.getEntryId(), original.reversedBy(e.getReversalEntry().getEntryId()));
            record(e.getReversalEntry());
        } else if (event instanceof AccountPeriodClosedEvent e) {
            periodSummaries.add(e.getSummary());
            currentPeriod = YearMonth.of(e.getSummary().getYear(), e.getSummary().getMonth()).plusMonths(1);
        } else if (event instanceof AccountStatusChangedEvent e) {
            active = e.isActive();
        } else if (event instanceof AccountUpdatedEvent e) {
            name = e.getName();
            description = e.getDescription();
        }
        lastModifiedAt = event.getOccurredAt();
        lastModifiedBy = event.getPerformedBy();
    }

    private void record(AccountEntry entry) {
        entries.put(entry.getEntryId(), entry);
        balance = entry.getBalanceAfter();
        if (sideOf(entry) == BalanceSide.DEBIT) {
            totalDebits = totalDebits.add(entry.getAmount());
        } else {
            totalCredits = totalCredits.add(entry.getAmount());
        }
    }

    // ==================== Helpers ====================

    private PostingResult post(BalanceSide side, BigDecimal amount, String description, String performedBy,
                               EntryReference reference, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        requireActive();
        BigDecimal previous = balance;
        BigDecimal effect = side == accountType.getNormalBalance() ? amount : amount.negate();
        EntryType type = side == BalanceSide.DEBIT ? EntryType.DEBIT : EntryType.CREDIT;
        AccountEntry entry = newEntry(type, amount, effect, description, performedBy, now, reference).build();
        raise(new EntryPostedEvent(entry, performedBy, now));
        return PostingResult.of(entry, previous);
    }

    private AccountEntry.AccountEntryBuilder newEntry(EntryType type, BigDecimal amount, BigDecimal effect,
                                                      String description, String performedBy, Instant now,
                                                      EntryReference reference) {
        AccountEntry.AccountEntryBuilder builder = AccountEntry.builder()
            .entryId(UUID.randomUUID())
            .entryType(type)
            .amount(amount)
            .effect(effect)
            .balanceAfter(balance.add(effect))
            .description(description)
            .performedBy(performedBy)
            .timestamp(now)
            .periodYear(currentPeriod.getYear())
            .periodMonth(currentPeriod.getMonthValue())
            .status(EntryStatus.POSTED);
        if (reference != null) {
            builder.referenceType(reference.getReferenceType())
                .referenceId(reference.getReferenceId())
                .referenceNumber(reference.getReferenceNumber());
        }
        return builder;
    }

    /**
     * The side on which an entry's effect landed: a positive effect is on the normal side.
     */
    private BalanceSide sideOf(AccountEntry entry) {
        BalanceSide normal = accountType.getNormalBalance();
        return entry.getEffect().signum() >= 0 ? normal : normal.opposite();
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Account not initialized");
        }
    }

    private void requireActive() {
        requireInitialized();
        if (!active) {
            throw new IllegalStateException("Account is not active");
        }
    }

    private static String resolveCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return DEFAULT_CURRENCY;
        }
        try {
            return Currency.getInstance(currency.trim().toUpperCase()).getCurrencyCode();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency: " + currency, e);
        }
    }
}
