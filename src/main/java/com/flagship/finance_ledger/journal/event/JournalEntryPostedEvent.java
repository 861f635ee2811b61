package com.flagship.finance_ledger.journal.event;

import lombok.Value;

import java.time.Instant;

@Value
public class JournalEntryPostedEvent implements JournalEntryEvent {
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
