package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PostingResult {
    UUID entryId;
    EntryType entryType;
    BigDecimal amount;
    BigDecimal previousBalance;
    BigDecimal newBalance;

    static PostingResult of(AccountEntry entry, BigDecimal previousBalance) {
        return new PostingResult(entry.getEntryId(), entry.getEntryType(), entry.getAmount(),
            previousBalance, entry.getBalanceAfter());
    }
}
