package com.flagship.finance_ledger.payment;

public enum PaymentMethod {
    CASH,
    CARD
}
