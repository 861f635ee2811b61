package com.flagship.finance_ledger.ledger.event;

import com.flagship.finance_ledger.ledger.AccountEntry;
import lombok.Value;

import java.time.Instant;

/**
 * A debit, credit, adjustment or opening entry was appended.
 */
@Value
public class EntryPostedEvent implements AccountLedgerEvent {
    AccountEntry entry;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
