package com.flagship.finance_ledger;

import com.flagship.finance_ledger.idempotency.IdempotencyKeyCleanupJob;
import com.flagship.finance_ledger.observability.HealthIndicators;
import com.flagship.finance_ledger.payment.GatewayResponse;
import com.flagship.finance_ledger.payment.Payment;
import com.flagship.finance_ledger.payment.PaymentGateway;
import com.flagship.finance_ledger.payment.PaymentMethod;
import com.flagship.finance_ledger.payment.PaymentProcessingService;
import com.flagship.finance_ledger.payment.PaymentStatus;
import com.flagship.finance_ledger.retry.CircuitBreakerRegistry;
import com.flagship.finance_ledger.runtime.EventStore;
import com.flagship.finance_ledger.runtime.InMemoryEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Application wiring tests in the default in-memory mode.
 *
 * These tests verify that:
 * - The in-memory event store is selected when no persistence mode is set
 * - Services, health indicators and metrics are wired together
 * - A registered PaymentGateway bean replaces the unconfigured default
 */
@SpringBootTest(properties = "ledger.retry.base-delay-ms=1")
class FinanceLedgerApplicationTest {

    @Autowired
    private EventStore eventStore;

    @Autowired
    private PaymentProcessingService paymentService;

    @Autowired
    private CircuitBreakerRegistry circuitBreakers;

    @Autowired
    private HealthIndicators.CircuitBreakerHealthIndicator circuitBreakerHealth;

    @Autowired
    private HealthIndicators.EventStoreHealthIndicator eventStoreHealth;

    @Autowired
    private IdempotencyKeyCleanupJob cleanupJob;

    @Autowired
    private MeterRegistry meterRegistry;

    @MockBean
    private PaymentGateway paymentGateway;

    @AfterEach
    void tearDown() {
        circuitBreakers.resetAll();
    }

    @Test
    @DisplayName("In-memory event store is the default")
    void testDefaultEventStore() {
        assertInstanceOf(InMemoryEventStore.class, eventStore);
        assertEquals(Status.UP, eventStoreHealth.health().getStatus());
    }

    @Test
    @DisplayName("Card charge runs through the wired services and is counted")
    void testCardChargeWired() {
        when(paymentGateway.charge(any())).thenReturn(GatewayResponse.approved("txn_wired"));
        Payment payment = Payment.initiate(UUID.randomUUID(), UUID.randomUUID(), PaymentMethod.CARD,
            new BigDecimal("18.00"), "USD", Instant.now());

        Payment completed = paymentService.processCard(payment, "adyen", null);

        assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
        assertNotNull(meterRegistry.find("idempotency.acquire").tag("result", "acquired").counter());
    }

    @Test
    @DisplayName("Open circuits degrade the health status")
    void testCircuitBreakerHealth() {
        assertEquals(Status.UP, circuitBreakerHealth.health().getStatus());

        for (int i = 0; i < CircuitBreakerRegistry.DEFAULT_FAILURE_THRESHOLD; i++) {
            circuitBreakers.recordFailure("stripe");
        }

        assertEquals("DEGRADED", circuitBreakerHealth.health().getStatus().getCode());
        assertTrue(circuitBreakerHealth.health().getDetails().get("stripe").toString().startsWith("open until"));
    }

    @Test
    @DisplayName("Cleanup job sweeps without error when no keys exist")
    void testCleanupJobRuns() {
        assertDoesNotThrow(() -> cleanupJob.sweepExpiredKeys());
    }
}
