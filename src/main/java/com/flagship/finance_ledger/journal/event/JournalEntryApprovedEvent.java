package com.flagship.finance_ledger.journal.event;

import lombok.Value;

import java.time.Instant;

@Value
public class JournalEntryApprovedEvent implements JournalEntryEvent {
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryApproved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
