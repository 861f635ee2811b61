package com.flagship.finance_ledger.journal.event;

import com.flagship.finance_ledger.journal.JournalLine;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class JournalEntryCreatedEvent implements JournalEntryEvent {
    UUID entryId;
    UUID organizationId;
    String entryNumber;
    LocalDate postingDate;
    String memo;
    String referenceType;
    UUID referenceId;
    String referenceNumber;
    List<JournalLine> lines;
    UUID reversalOfEntryId;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
