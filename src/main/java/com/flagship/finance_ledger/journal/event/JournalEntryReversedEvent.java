package com.flagship.finance_ledger.journal.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class JournalEntryReversedEvent implements JournalEntryEvent {
    UUID reversalEntryId;
    String reason;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
