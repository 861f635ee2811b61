package com.flagship.finance_ledger.payment;

import com.flagship.finance_ledger.idempotency.IdempotencyService;
import com.flagship.finance_ledger.idempotency.ResultHashes;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.retry.CircuitBreakerRegistry;
import com.flagship.finance_ledger.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives payments through completion and refund.
 *
 * Card charges are guarded in this order:
 * 1. The idempotency key idem_charge_{paymentId} must not have completed successfully
 * 2. The processor's circuit must not be open
 * 3. Retryable gateway errors are retried with RetryPolicy delays; terminal ones fail at once
 *
 * Every attempt's outcome feeds the circuit breaker, and the final outcome is recorded on
 * the idempotency key. A failed charge leaves the key reusable.
 */
@Service
@Slf4j
public class PaymentProcessingService {

    static final String CHARGE_OPERATION = "charge";

    private final IdempotencyService idempotencyService;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry circuitBreakers;
    private final PaymentGateway gateway;
    private final Sleeper sleeper;
    private final ResultHashes resultHashes;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final boolean allowUnderpayment;

    public PaymentProcessingService(IdempotencyService idempotencyService, RetryPolicy retryPolicy,
                                    CircuitBreakerRegistry circuitBreakers, PaymentGateway gateway, Sleeper sleeper,
                                    ResultHashes resultHashes, LedgerMetrics metrics, Clock clock,
                                    @Value("${ledger.payment.allow-underpayment:false}") boolean allowUnderpayment) {
        this.idempotencyService = idempotencyService;
        this.retryPolicy = retryPolicy;
        this.circuitBreakers = circuitBreakers;
        this.gateway = gateway;
        this.sleeper = sleeper;
        this.resultHashes = resultHashes;
        this.metrics = metrics;
        this.clock = clock;
        this.allowUnderpayment = allowUnderpayment;
    }

    public Payment completeCash(Payment payment, BigDecimal amountTendered, BigDecimal tip) {
        requirePayment(payment);
        Payment completed = payment.completeCash(amountTendered, tip, allowUnderpayment, clock.instant());
        if (completed.getChangeGiven().signum() < 0) {
            log.warn("Payment {} accepted with underpayment of {}", payment.getId(),
                completed.getChangeGiven().negate());
        }
        log.info("Cash payment {} completed: total={}, tendered={}, change={}", payment.getId(),
            completed.getTotalAmount(), amountTendered, completed.getChangeGiven());
        return completed;
    }

    /**
     * Charges a card payment through the gateway.
     *
     * @return the payment COMPLETED, or FAILED when the gateway declined or retries ran out
     * @throws IllegalStateException if the charge already succeeded or the processor's circuit is open
     */
    public Payment processCard(Payment payment, String processorKey, BigDecimal tip) {
        requirePayment(payment);
        if (processorKey == null || processorKey.isBlank()) {
            throw new IllegalArgumentException("Processor key is required");
        }
        return CorrelationContext.withContext(payment.getOrganizationId().toString(),
            () -> charge(payment, processorKey, tip));
    }

    public Payment refund(Payment payment, BigDecimal amount, String reason) {
        requirePayment(payment);
        Payment refunded = payment.refund(amount, clock.instant());
        log.info("Payment {} refunded {} ({}): refunded total {}, remaining {}", payment.getId(), amount, reason,
            refunded.getRefundedAmount(), refunded.getRefundableAmount());
        return refunded;
    }

    public static String chargeKey(Payment payment) {
        return "idem_charge_" + payment.getId();
    }

    private Payment charge(Payment payment, String processorKey, BigDecimal tip) {
        if (payment.getStatus() != PaymentStatus.INITIATED) {
            throw new IllegalStateException(String.format(
                "Cannot charge payment in %s status. Only INITIATED payments can be charged.", payment.getStatus()));
        }
        String key = chargeKey(payment);
        if (!idempotencyService.tryAcquire(payment.getOrganizationId(), key, CHARGE_OPERATION, payment.getId())) {
            throw new IllegalStateException("Payment " + payment.getId() + " has already been charged");
        }
        if (circuitBreakers.isCircuitOpen(processorKey)) {
            throw new IllegalStateException("Circuit open for processor " + processorKey + "; charge not attempted");
        }

        BigDecimal total = payment.getAmount().add(tip != null ? tip : BigDecimal.ZERO);
        int attempt = 0;
        while (true) {
            GatewayResponse response = callGateway(new GatewayChargeRequest(payment.getId(), processorKey, key,
                total, payment.getCurrency(), attempt));

            if (response.isSuccessful()) {
                circuitBreakers.recordSuccess(processorKey);
                Payment completed = payment.completeCard(tip, response.getTransactionId(), clock.instant());
                idempotencyService.markKeyUsed(payment.getOrganizationId(), key, true,
                    resultHashes.compute(response.getTransactionId()));
                log.info("Card payment {} completed on attempt {}: transaction={}", payment.getId(), attempt + 1,
                    response.getTransactionId());
                return completed;
            }

            circuitBreakers.recordFailure(processorKey);
            String code = response.getErrorCode();
            boolean retry = retryPolicy.isRetryableError(code) && retryPolicy.shouldRetry(attempt, code)
                && !circuitBreakers.isCircuitOpen(processorKey);
            if (!retry) {
                log.warn("Card payment {} failed on attempt {}: code={}, terminal={}", payment.getId(), attempt + 1,
                    code, retryPolicy.isTerminalError(code));
                idempotencyService.markKeyUsed(payment.getOrganizationId(), key, false, null);
                return payment.fail(failureReason(response), clock.instant());
            }

            Duration delay = retryPolicy.getRetryDelay(attempt);
            log.info("Card payment {} attempt {} failed with {}, retrying in {} ms", payment.getId(), attempt + 1,
                code, delay.toMillis());
            metrics.recordRetryAttempt(processorKey);
            pause(delay);
            attempt++;
        }
    }

    private GatewayResponse callGateway(GatewayChargeRequest request) {
        Instant started = clock.instant();
        try {
            return gateway.charge(request);
        } catch (RuntimeException e) {
            log.warn("Gateway call for payment {} threw: {}", request.getPaymentId(), e.getMessage(), e);
            return GatewayResponse.declined("api_connection_error", e.getMessage());
        } finally {
            metrics.recordGatewayLatency(request.getProcessorKey(), Duration.between(started, clock.instant()));
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry charge", e);
        }
    }

    private static String failureReason(GatewayResponse response) {
        if (response.getErrorMessage() == null) {
            return response.getErrorCode();
        }
        return response.getErrorCode() + ": " + response.getErrorMessage();
    }

    private static void requirePayment(Payment payment) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
    }
}
