package com.flagship.finance_ledger.journal.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.finance_ledger.runtime.EntityEvent;

/**
 * Events of one journal entry, including the per-line acknowledgements of the posting saga.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = JournalEntryCreatedEvent.class, name = JournalEntryCreatedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = JournalEntryApprovedEvent.class, name = JournalEntryApprovedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = JournalEntryRejectedEvent.class, name = JournalEntryRejectedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = PostingStartedEvent.class, name = PostingStartedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = LinePostedEvent.class, name = LinePostedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = JournalEntryPostedEvent.class, name = JournalEntryPostedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = JournalEntryVoidedEvent.class, name = JournalEntryVoidedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = JournalEntryReversedEvent.class, name = JournalEntryReversedEvent.EVENT_TYPE)
})
public interface JournalEntryEvent extends EntityEvent {
}
