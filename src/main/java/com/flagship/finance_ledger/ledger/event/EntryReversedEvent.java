package com.flagship.finance_ledger.ledger.event;

import com.flagship.finance_ledger.ledger.AccountEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A reversal entry was appended and the original entry marked reversed.
 */
@Value
public class EntryReversedEvent implements AccountLedgerEvent {
    UUID reversedEntryId;
    AccountEntry reversalEntry;
    String reason;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountEntryReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
