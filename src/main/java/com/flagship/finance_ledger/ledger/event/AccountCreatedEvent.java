package com.flagship.finance_ledger.ledger.event;

import com.flagship.finance_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class AccountCreatedEvent implements AccountLedgerEvent {
    UUID accountId;
    String accountCode;
    String name;
    String description;
    AccountType accountType;
    String currency;
    BigDecimal openingBalance;
    boolean systemAccount;
    int periodYear;
    int periodMonth;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
