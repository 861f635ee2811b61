package com.flagship.finance_ledger.retry;

import com.flagship.finance_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide circuit breakers, one per external processor key.
 *
 * State lives in a {@link ConcurrentHashMap} of immutable snapshots and every transition
 * goes through {@code compute}, so concurrent failures and successes for the same key are
 * applied atomically and none are lost.
 *
 * Lifecycle:
 * - CLOSED: failures are counted; the 6th consecutive failure opens the circuit
 * - OPEN: {@link #isCircuitOpen} is true until the open duration passes
 * - HALF_OPEN: the first check after expiry lets a probe through; success closes the
 *   circuit, failure reopens it
 *
 * State is only discarded by {@link #resetCircuit} or {@link #resetAll}.
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    public static final int DEFAULT_FAILURE_THRESHOLD = 6;
    public static final Duration DEFAULT_OPEN_DURATION = Duration.ofMinutes(1);

    private final Map<String, CircuitBreakerSnapshot> circuits = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration defaultOpenDuration;
    private final Clock clock;
    private final LedgerMetrics metrics;

    @Autowired
    public CircuitBreakerRegistry(@Value("${ledger.circuit-breaker.failure-threshold:6}") int failureThreshold,
                                  @Value("${ledger.circuit-breaker.open-duration:PT1M}") Duration defaultOpenDuration,
                                  Clock clock,
                                  LedgerMetrics metrics) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.defaultOpenDuration = defaultOpenDuration;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CircuitBreakerSnapshot recordFailure(String processorKey) {
        return recordFailure(processorKey, defaultOpenDuration);
    }

    /**
     * Records a failed call. Opens the circuit for {@code openDuration} once the consecutive
     * failure count reaches the threshold, or immediately when the failure was a half-open probe.
     */
    public CircuitBreakerSnapshot recordFailure(String processorKey, Duration openDuration) {
        requireKey(processorKey);
        Instant now = clock.instant();
        CircuitBreakerSnapshot[] previous = new CircuitBreakerSnapshot[1];
        CircuitBreakerSnapshot updated = circuits.compute(processorKey, (key, current) -> {
            CircuitBreakerSnapshot base = current != null ? current : CircuitBreakerSnapshot.closed(key);
            previous[0] = base;
            return base.withFailure(now, failureThreshold, openDuration);
        });

        if (previous[0].getState() != CircuitState.OPEN && updated.getState() == CircuitState.OPEN) {
            log.warn("Circuit opened for processor {} after {} consecutive failures, open until {}",
                    processorKey, updated.getConsecutiveFailures(), updated.getOpenUntil());
            metrics.recordCircuitOpened(processorKey);
        }
        return updated;
    }

    /**
     * Records a successful call: the failure count resets and the circuit closes.
     */
    public CircuitBreakerSnapshot recordSuccess(String processorKey) {
        requireKey(processorKey);
        CircuitBreakerSnapshot updated = circuits.compute(processorKey, (key, current) ->
                current != null ? current.withSuccess() : CircuitBreakerSnapshot.closed(key));
        log.debug("Circuit closed for processor {}", processorKey);
        return updated;
    }

    /**
     * True while the circuit is open. An open circuit whose open period has passed moves to
     * HALF_OPEN and reports false, letting the caller send a probe.
     */
    public boolean isCircuitOpen(String processorKey) {
        requireKey(processorKey);
        Instant now = clock.instant();
        CircuitBreakerSnapshot snapshot = circuits.computeIfPresent(processorKey, (key, current) -> {
            if (current.getState() == CircuitState.OPEN && !current.isOpenAt(now)) {
                log.info("Circuit for processor {} is now half-open", key);
                return current.halfOpen();
            }
            return current;
        });
        return snapshot != null && snapshot.isOpenAt(now);
    }

    public Optional<CircuitBreakerSnapshot> getCircuitState(String processorKey) {
        return Optional.ofNullable(circuits.get(processorKey));
    }

    /**
     * All circuits currently in the OPEN state.
     */
    public List<CircuitBreakerSnapshot> openCircuits() {
        return circuits.values().stream()
                .filter(snapshot -> snapshot.getState() == CircuitState.OPEN)
                .toList();
    }

    public void resetCircuit(String processorKey) {
        circuits.remove(processorKey);
        log.info("Circuit reset for processor {}", processorKey);
    }

    public void resetAll() {
        circuits.clear();
    }

    private static void requireKey(String processorKey) {
        if (processorKey == null || processorKey.isBlank()) {
            throw new IllegalArgumentException("Processor key is required");
        }
    }
}
