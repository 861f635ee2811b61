package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable line of an account's history.
 *
 * {@code amount} is never negative. {@code effect} is the signed change the entry made
 * to the balance, so the balance is always the sum of all effects.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AccountEntry {
    UUID entryId;
    EntryType entryType;
    BigDecimal amount;
    BigDecimal effect;
    BigDecimal balanceAfter;
    String description;
    String performedBy;
    Instant timestamp;
    int periodYear;
    int periodMonth;
    String referenceType;
    UUID referenceId;
    String referenceNumber;
    EntryStatus status;
    UUID reversalEntryId;
    UUID reversedEntryId;

    public boolean matchesReference(String type, UUID id) {
        return type.equals(referenceType) && id.equals(referenceId);
    }

    AccountEntry reversedBy(UUID reversalId) {
        return toBuilder()
            .status(EntryStatus.REVERSED)
            .reversalEntryId(reversalId)
            .build();
    }
}
