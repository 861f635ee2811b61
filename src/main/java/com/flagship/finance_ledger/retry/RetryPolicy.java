package com.flagship.finance_ledger.retry;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry decisions for calls to external payment processors.
 *
 * Delays grow exponentially (1s, 2s, 4s, 8s, 16s, then capped at 16s) with multiplicative
 * jitter. Error codes are classified into terminal (a decline: never retry) and retryable
 * (transient transport or processor trouble). Anything unrecognized is neither, and is not
 * retried automatically.
 *
 * Codes are matched case-insensitively on a normalized form where spaces and hyphens become
 * underscores, and a known code anywhere inside the given code counts as a match. This
 * covers both Stripe-style ("card_declined") and Adyen-style ("Not enough balance") codes.
 */
@Component
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 5;

    private static final List<String> TERMINAL_CODES = List.of(
        "card_declined",
        "insufficient_funds",
        "expired_card",
        "incorrect_cvc",
        "incorrect_number",
        "invalid_card_type",
        "stolen_card",
        "lost_card",
        "fraudulent",
        "card_not_supported",
        "currency_not_supported",
        "duplicate_transaction",
        "invalid_amount",
        "invalid_cvc",
        "invalid_expiry_month",
        "invalid_expiry_year",
        "invalid_number",
        "postal_code_invalid",
        // Adyen refusal reasons
        "refused",
        "not_enough_balance",
        "blocked_card",
        "invalid_card_number",
        "invalid_pin",
        "pin_tries_exceeded",
        "fraud",
        "shopper_cancelled",
        "cvc_declined",
        "restricted_card",
        "revocation_of_auth",
        "declined_non_generic",
        "declined"
    );

    private static final List<String> RETRYABLE_CODES = List.of(
        "processing_error",
        "rate_limit",
        "api_connection_error",
        "api_error",
        "timeout",
        "lock_timeout",
        "acquirer_error",
        "issuer_unavailable",
        "service_unavailable"
    );

    private final int maxRetries;
    private final Duration baseDelay;
    private final int maxExponent;
    private final double jitter;
    private final Clock clock;

    @Autowired
    public RetryPolicy(@Value("${ledger.retry.max-retries:5}") int maxRetries,
                       @Value("${ledger.retry.base-delay-ms:1000}") long baseDelayMs,
                       @Value("${ledger.retry.max-exponent:4}") int maxExponent,
                       @Value("${ledger.retry.jitter:0.25}") double jitter,
                       Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("Jitter must be in [0, 1): " + jitter);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Duration.ofMillis(baseDelayMs);
        this.maxExponent = maxExponent;
        this.jitter = jitter;
        this.clock = clock;
    }

    public RetryPolicy(Clock clock) {
        this(DEFAULT_MAX_RETRIES, 1000, 4, 0.25, clock);
    }

    /**
     * Delay before retry number {@code attempt}. Negative attempts count as attempt 0.
     * The result lies in [base * (1 - jitter), base * (1 + jitter)] where
     * base = baseDelay * 2^min(attempt, maxExponent).
     */
    public Duration getRetryDelay(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), maxExponent);
        long baseMillis = baseDelay.toMillis() * (1L << exponent);
        double factor = jitter == 0 ? 1.0 : 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
        return Duration.ofMillis(Math.round(baseMillis * factor));
    }

    public Instant getNextRetryTime(int attempt) {
        return clock.instant().plus(getRetryDelay(attempt));
    }

    public boolean shouldRetry(int attempt, String errorCode) {
        if (attempt >= maxRetries) {
            return false;
        }
        return !isTerminalError(errorCode);
    }

    public boolean isTerminalError(String errorCode) {
        return matches(errorCode, TERMINAL_CODES);
    }

    public boolean isRetryableError(String errorCode) {
        if (isTerminalError(errorCode)) {
            return false;
        }
        return matches(errorCode, RETRYABLE_CODES);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private static boolean matches(String errorCode, List<String> codes) {
        if (errorCode == null || errorCode.isBlank()) {
            return false;
        }
        String normalized = normalize(errorCode);
        for (String code : codes) {
            if (normalized.contains(code)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String errorCode) {
        return errorCode.trim()
                .toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
    }
}
