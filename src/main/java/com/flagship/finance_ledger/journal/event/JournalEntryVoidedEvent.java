package com.flagship.finance_ledger.journal.event;

import lombok.Value;

import java.time.Instant;

@Value
public class JournalEntryVoidedEvent implements JournalEntryEvent {
    String reason;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryVoided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
