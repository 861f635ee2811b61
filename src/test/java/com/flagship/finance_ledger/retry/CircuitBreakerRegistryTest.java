package com.flagship.finance_ledger.retry;

import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerRegistry tests.
 *
 * These tests verify that:
 * - The circuit opens on the 6th consecutive failure
 * - Any success resets the failure count
 * - An expired open circuit lets one probe through (half-open)
 * - Concurrent failures are all counted
 */
class CircuitBreakerRegistryTest {

    private static final String STRIPE = "stripe";

    private MutableClock clock;
    private CircuitBreakerRegistry registry;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new CircuitBreakerRegistry(CircuitBreakerRegistry.DEFAULT_FAILURE_THRESHOLD,
            CircuitBreakerRegistry.DEFAULT_OPEN_DURATION, clock, new LedgerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Six consecutive failures open the circuit")
    void testOpensAfterSixFailures() {
        printTestHeader("Circuit Opens After Six Failures");

        for (int i = 1; i <= 5; i++) {
            registry.recordFailure(STRIPE);
            assertFalse(registry.isCircuitOpen(STRIPE), "open too early after " + i + " failures");
        }
        CircuitBreakerSnapshot snapshot = registry.recordFailure(STRIPE);

        printOutput("Snapshot", snapshot);
        assertTrue(registry.isCircuitOpen(STRIPE));
        assertEquals(CircuitState.OPEN, snapshot.getState());
        assertEquals(6, snapshot.getConsecutiveFailures());
        assertEquals(1, registry.openCircuits().size());
        printSuccess("Circuit opened on the 6th failure");
    }

    @Test
    @DisplayName("A success resets the failure count")
    void testSuccessResets() {
        printTestHeader("Success Resets Failures");

        for (int i = 0; i < 5; i++) {
            registry.recordFailure(STRIPE);
        }
        registry.recordSuccess(STRIPE);
        assertEquals(0, registry.getCircuitState(STRIPE).orElseThrow().getConsecutiveFailures());

        registry.recordFailure(STRIPE);
        assertFalse(registry.isCircuitOpen(STRIPE));
        printSuccess("Counter restarted from zero");
    }

    @Test
    @DisplayName("Expired open circuit goes half-open and a failed probe reopens it")
    void testHalfOpen() {
        printTestHeader("Half-Open Probe");

        for (int i = 0; i < 6; i++) {
            registry.recordFailure(STRIPE);
        }
        clock.advance(Duration.ofSeconds(61));

        assertFalse(registry.isCircuitOpen(STRIPE));
        assertEquals(CircuitState.HALF_OPEN, registry.getCircuitState(STRIPE).orElseThrow().getState());

        registry.recordFailure(STRIPE);
        assertTrue(registry.isCircuitOpen(STRIPE));

        clock.advance(Duration.ofSeconds(61));
        assertFalse(registry.isCircuitOpen(STRIPE));
        registry.recordSuccess(STRIPE);
        assertEquals(CircuitState.CLOSED, registry.getCircuitState(STRIPE).orElseThrow().getState());
        printSuccess("Probe failure reopened, probe success closed");
    }

    @Test
    @DisplayName("Custom open duration is honored")
    void testCustomOpenDuration() {
        for (int i = 0; i < 6; i++) {
            registry.recordFailure("adyen", Duration.ofMinutes(5));
        }
        clock.advance(Duration.ofMinutes(2));
        assertTrue(registry.isCircuitOpen("adyen"));
        clock.advance(Duration.ofMinutes(4));
        assertFalse(registry.isCircuitOpen("adyen"));
    }

    @Test
    @DisplayName("Circuits are independent per processor and can be reset")
    void testIndependentAndReset() {
        for (int i = 0; i < 6; i++) {
            registry.recordFailure(STRIPE);
        }
        assertFalse(registry.isCircuitOpen("adyen"));

        registry.resetCircuit(STRIPE);
        assertFalse(registry.isCircuitOpen(STRIPE));
        assertTrue(registry.getCircuitState(STRIPE).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.recordFailure(" "));
    }

    @Test
    @DisplayName("Concurrent failures are all counted")
    void testConcurrentFailures() throws Exception {
        printTestHeader("Concurrent Failures");
        CircuitBreakerRegistry lenient = new CircuitBreakerRegistry(1000, Duration.ofMinutes(1), clock,
            new LedgerMetrics(new SimpleMeterRegistry()));

        int threads = 10;
        int failuresPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < failuresPerThread; i++) {
                        lenient.recordFailure(STRIPE);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        int counted = lenient.getCircuitState(STRIPE).orElseThrow().getConsecutiveFailures();
        printOutput("Counted Failures", counted);
        assertEquals(threads * failuresPerThread, counted);
        printSuccess("No failure lost");
    }
}
