package com.flagship.finance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.postings: Counter of account postings, tagged by entry type
 * - ledger.reversals: Counter of reversed account entries
 * - journal.transitions: Counter of journal entry status changes, tagged by status
 * - journal.posting.duration: Timer for the journal posting saga
 * - idempotency.acquire: Counter of TryAcquire outcomes (acquired/refused)
 * - idempotency.keys.purged: Counter of expired keys removed by cleanup
 * - payment.retry.attempts: Counter of gateway retries, tagged by processor
 * - circuit.opened: Counter of circuit breaker trips, tagged by processor
 * - period.transitions: Counter of fiscal period status changes, tagged by status
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter reversals;
    private final Counter keysPurged;
    private final Timer journalPostingTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reversals = Counter.builder("ledger.reversals")
                .description("Number of account entries reversed")
                .register(registry);

        this.keysPurged = Counter.builder("idempotency.keys.purged")
                .description("Number of expired idempotency keys removed")
                .register(registry);

        this.journalPostingTimer = Timer.builder("journal.posting.duration")
                .description("Time taken to post a journal entry to all accounts")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordPosting(String entryType) {
        registry.counter("ledger.postings", "entry_type", sanitizeTag(entryType)).increment();
    }

    public void incrementReversals() {
        reversals.increment();
    }

    // ==================== Journal ====================

    public void recordJournalTransition(String status) {
        registry.counter("journal.transitions", "status", sanitizeTag(status)).increment();
    }

    public <T> T timeJournalPosting(Supplier<T> operation) {
        return journalPostingTimer.record(operation);
    }

    // ==================== Periods ====================

    public void recordPeriodTransition(String status) {
        registry.counter("period.transitions", "status", sanitizeTag(status)).increment();
    }

    // ==================== Idempotency ====================

    public void recordIdempotencyAcquired() {
        registry.counter("idempotency.acquire", "result", "acquired").increment();
    }

    public void recordIdempotencyRefused() {
        registry.counter("idempotency.acquire", "result", "refused").increment();
    }

    public void recordKeysPurged(int count) {
        keysPurged.increment(count);
    }

    // ==================== Retry / circuit breaker ====================

    public void recordRetryAttempt(String processorKey) {
        registry.counter("payment.retry.attempts", "processor", sanitizeTag(processorKey)).increment();
    }

    public void recordCircuitOpened(String processorKey) {
        registry.counter("circuit.opened", "processor", sanitizeTag(processorKey)).increment();
    }

    public void recordGatewayLatency(String processorKey, Duration duration) {
        registry.timer("payment.gateway.latency", "processor", sanitizeTag(processorKey)).record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
