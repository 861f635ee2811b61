package com.flagship.finance_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class GatewayChargeRequest {
    UUID paymentId;
    String processorKey;
    String idempotencyKey;
    BigDecimal amount;
    String currency;
    int attempt;
}
