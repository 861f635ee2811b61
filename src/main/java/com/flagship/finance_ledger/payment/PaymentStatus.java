package com.flagship.finance_ledger.payment;

/**
 * Payment status.
 *
 * INITIATED moves to COMPLETED or FAILED. A COMPLETED payment can be refunded in
 * parts (PARTIALLY_REFUNDED) until nothing is left (REFUNDED).
 */
public enum PaymentStatus {
    INITIATED,
    COMPLETED,
    FAILED,
    PARTIALLY_REFUNDED,
    REFUNDED
}
