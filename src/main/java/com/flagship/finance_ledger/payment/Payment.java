package com.flagship.finance_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment taken against an order.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected
 * - State changes are immutable (each transition returns a new Payment)
 *
 * totalAmount is amount plus tip and is fixed when the payment completes; refunds are
 * bounded by what remains of it.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID organizationId;
    PaymentMethod method;
    BigDecimal amount;
    String currency;
    BigDecimal tipAmount;
    BigDecimal totalAmount;
    BigDecimal amountTendered;
    BigDecimal changeGiven;
    BigDecimal refundedAmount;
    PaymentStatus status;
    String gatewayTransactionId;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new Payment in INITIATED status.
     */
    public static Payment initiate(UUID id, UUID organizationId, PaymentMethod method, BigDecimal amount,
                                   String currency, Instant now) {
        if (id == null || organizationId == null) {
            throw new IllegalArgumentException("Payment ID and organization ID are required");
        }
        if (method == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        return Payment.builder()
            .id(id)
            .organizationId(organizationId)
            .method(method)
            .amount(amount)
            .currency(currency != null ? currency : "USD")
            .tipAmount(BigDecimal.ZERO)
            .totalAmount(amount)
            .refundedAmount(BigDecimal.ZERO)
            .status(PaymentStatus.INITIATED)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Completes a cash payment. Change is tendered minus total; it is negative only when
     * an underpayment was accepted.
     *
     * @throws IllegalArgumentException if tendered is below the total and underpayment is not allowed
     */
    public Payment completeCash(BigDecimal amountTendered, BigDecimal tip, boolean allowUnderpayment, Instant now) {
        requireInitiated(PaymentMethod.CASH, "complete");
        if (amountTendered == null || amountTendered.signum() < 0) {
            throw new IllegalArgumentException("Amount tendered must not be negative");
        }
        BigDecimal tipAmount = normalizeTip(tip);
        BigDecimal total = amount.add(tipAmount);
        if (amountTendered.compareTo(total) < 0 && !allowUnderpayment) {
            throw new IllegalArgumentException(String.format(
                "Amount tendered (%s) is less than total due (%s)", amountTendered, total));
        }
        return toBuilder()
            .tipAmount(tipAmount)
            .totalAmount(total)
            .amountTendered(amountTendered)
            .changeGiven(amountTendered.subtract(total))
            .status(PaymentStatus.COMPLETED)
            .updatedAt(now)
            .build();
    }

    public Payment completeCard(BigDecimal tip, String gatewayTransactionId, Instant now) {
        requireInitiated(PaymentMethod.CARD, "complete");
        BigDecimal tipAmount = normalizeTip(tip);
        return toBuilder()
            .tipAmount(tipAmount)
            .totalAmount(amount.add(tipAmount))
            .gatewayTransactionId(gatewayTransactionId)
            .status(PaymentStatus.COMPLETED)
            .updatedAt(now)
            .build();
    }

    public Payment fail(String reason, Instant now) {
        if (status != PaymentStatus.INITIATED) {
            throw new IllegalStateException(String.format(
                "Cannot fail payment in %s status. Only INITIATED payments can be failed.", status));
        }
        return toBuilder()
            .status(PaymentStatus.FAILED)
            .failureReason(reason)
            .updatedAt(now)
            .build();
    }

    /**
     * @throws IllegalStateException if the payment is not completed or the amount exceeds what is left
     */
    public Payment refund(BigDecimal refundAmount, Instant now) {
        if (status != PaymentStatus.COMPLETED && status != PaymentStatus.PARTIALLY_REFUNDED) {
            throw new IllegalStateException("Can only refund completed payments (current: " + status + ")");
        }
        if (refundAmount == null || refundAmount.signum() <= 0) {
            throw new IllegalArgumentException("Refund amount must be positive");
        }
        if (refundAmount.compareTo(getRefundableAmount()) > 0) {
            throw new IllegalStateException("Refund amount exceeds available balance");
        }
        BigDecimal refunded = refundedAmount.add(refundAmount);
        return toBuilder()
            .refundedAmount(refunded)
            .status(refunded.compareTo(totalAmount) >= 0 ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED)
            .updatedAt(now)
            .build();
    }

    public BigDecimal getRefundableAmount() {
        return totalAmount.subtract(refundedAmount);
    }

    private void requireInitiated(PaymentMethod expected, String action) {
        if (method != expected) {
            throw new IllegalStateException(String.format(
                "Cannot %s %s payment as %s", action, method, expected));
        }
        if (status != PaymentStatus.INITIATED) {
            throw new IllegalStateException(String.format(
                "Cannot %s payment in %s status. Only INITIATED payments can be completed.", action, status));
        }
    }

    private static BigDecimal normalizeTip(BigDecimal tip) {
        if (tip == null) {
            return BigDecimal.ZERO;
        }
        if (tip.signum() < 0) {
            throw new IllegalArgumentException("Tip amount must not be negative");
        }
        return tip;
    }
}
