package com.flagship.finance_ledger.retry;

import com.flagship.finance_ledger.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy tests: exponential backoff with jitter, and error classification.
 */
class RetryPolicyTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Delay doubles per attempt and stops growing at the max exponent")
    void testDelayWithoutJitter() {
        printTestHeader("Backoff Without Jitter");
        RetryPolicy policy = new RetryPolicy(5, 1000, 4, 0.0, clock);

        for (int attempt = 0; attempt <= 6; attempt++) {
            printOutput("Attempt " + attempt, policy.getRetryDelay(attempt));
        }
        assertEquals(Duration.ofSeconds(1), policy.getRetryDelay(0));
        assertEquals(Duration.ofSeconds(2), policy.getRetryDelay(1));
        assertEquals(Duration.ofSeconds(8), policy.getRetryDelay(3));
        assertEquals(Duration.ofSeconds(16), policy.getRetryDelay(4));
        assertEquals(Duration.ofSeconds(16), policy.getRetryDelay(10));
        assertEquals(Duration.ofSeconds(1), policy.getRetryDelay(-3));
    }

    @Test
    @DisplayName("Jittered delay stays within 25% of the base delay")
    void testDelayJitterBounds() {
        printTestHeader("Backoff Jitter Bounds");
        RetryPolicy policy = new RetryPolicy(clock);

        for (int i = 0; i < 200; i++) {
            long millis = policy.getRetryDelay(2).toMillis();
            assertTrue(millis >= 3000 && millis <= 5000, "delay out of range: " + millis);
        }
    }

    @Test
    @DisplayName("Next retry time is now plus the delay")
    void testNextRetryTime() {
        RetryPolicy policy = new RetryPolicy(5, 1000, 4, 0.0, clock);
        assertEquals(clock.instant().plusSeconds(4), policy.getNextRetryTime(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"card_declined", "insufficient_funds", "Not enough balance", "Refused", "expired-card",
        "do_not_honor_declined", "LOST_CARD"})
    @DisplayName("Terminal codes are never retried")
    void testTerminalCodes(String code) {
        RetryPolicy policy = new RetryPolicy(clock);
        assertTrue(policy.isTerminalError(code));
        assertFalse(policy.isRetryableError(code));
        assertFalse(policy.shouldRetry(0, code));
    }

    @ParameterizedTest
    @ValueSource(strings = {"rate_limit", "api_connection_error", "Timeout", "issuer unavailable",
        "service_unavailable"})
    @DisplayName("Transient codes are retryable")
    void testRetryableCodes(String code) {
        RetryPolicy policy = new RetryPolicy(clock);
        assertTrue(policy.isRetryableError(code));
        assertTrue(policy.shouldRetry(0, code));
    }

    @Test
    @DisplayName("Retries stop at the maximum attempt count")
    void testMaxRetries() {
        RetryPolicy policy = new RetryPolicy(clock);
        assertEquals(RetryPolicy.DEFAULT_MAX_RETRIES, policy.getMaxRetries());
        assertTrue(policy.shouldRetry(4, "timeout"));
        assertFalse(policy.shouldRetry(5, "timeout"));
    }

    @Test
    @DisplayName("Blank and unknown codes are neither terminal nor retryable")
    void testUnknownCodes() {
        RetryPolicy policy = new RetryPolicy(clock);
        assertFalse(policy.isTerminalError(null));
        assertFalse(policy.isRetryableError(""));
        assertFalse(policy.isTerminalError("something_new"));
        assertFalse(policy.isRetryableError("something_new"));
    }
}
