package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Links an account entry to the business document that caused it,
 * e.g. type "JournalEntry" with the journal entry's id.
 */
@Value
public class EntryReference {
    String referenceType;
    UUID referenceId;
    String referenceNumber;

    public static EntryReference of(String referenceType, UUID referenceId, String referenceNumber) {
        if (referenceType == null || referenceType.isBlank()) {
            throw new IllegalArgumentException("Reference type is required");
        }
        if (referenceId == null) {
            throw new IllegalArgumentException("Reference ID is required");
        }
        return new EntryReference(referenceType, referenceId, referenceNumber);
    }
}
