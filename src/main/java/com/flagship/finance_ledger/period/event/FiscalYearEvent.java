package com.flagship.finance_ledger.period.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.finance_ledger.runtime.EntityEvent;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FiscalYearInitializedEvent.class, name = FiscalYearInitializedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = PeriodOpenedEvent.class, name = PeriodOpenedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = PeriodClosedEvent.class, name = PeriodClosedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = PeriodLockedEvent.class, name = PeriodLockedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = PeriodReopenedEvent.class, name = PeriodReopenedEvent.EVENT_TYPE),
    @JsonSubTypes.Type(value = YearEndClosedEvent.class, name = YearEndClosedEvent.EVENT_TYPE)
})
public interface FiscalYearEvent extends EntityEvent {

    String getPerformedBy();
}
