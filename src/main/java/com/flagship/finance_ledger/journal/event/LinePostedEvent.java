package com.flagship.finance_ledger.journal.event;

import com.flagship.finance_ledger.journal.LinePosting;
import lombok.Value;

import java.time.Instant;

/**
 * One line of the posting saga reached its account.
 */
@Value
public class LinePostedEvent implements JournalEntryEvent {
    LinePosting posting;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalLinePosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
