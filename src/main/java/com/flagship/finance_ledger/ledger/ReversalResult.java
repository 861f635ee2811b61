package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ReversalResult {
    UUID reversalEntryId;
    UUID reversedEntryId;
    BigDecimal amountReversed;
    BigDecimal previousBalance;
    BigDecimal newBalance;
}
