package com.flagship.finance_ledger.retry;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable circuit breaker state for one processor key.
 * Every transition returns a new snapshot.
 */
@Value
public class CircuitBreakerSnapshot {
    String processorKey;
    int consecutiveFailures;
    CircuitState state;
    Instant lastFailureAt;
    Instant openUntil;

    static CircuitBreakerSnapshot closed(String processorKey) {
        return new CircuitBreakerSnapshot(processorKey, 0, CircuitState.CLOSED, null, null);
    }

    CircuitBreakerSnapshot withFailure(Instant now, int failureThreshold, Duration openDuration) {
        int failures = consecutiveFailures + 1;
        if (state == CircuitState.HALF_OPEN || failures >= failureThreshold) {
            return new CircuitBreakerSnapshot(processorKey, failures, CircuitState.OPEN, now, now.plus(openDuration));
        }
        return new CircuitBreakerSnapshot(processorKey, failures, state, now, openUntil);
    }

    CircuitBreakerSnapshot withSuccess() {
        return new CircuitBreakerSnapshot(processorKey, 0, CircuitState.CLOSED, lastFailureAt, null);
    }

    CircuitBreakerSnapshot halfOpen() {
        return new CircuitBreakerSnapshot(processorKey, consecutiveFailures, CircuitState.HALF_OPEN, lastFailureAt, null);
    }

    boolean isOpenAt(Instant now) {
        return state == CircuitState.OPEN && openUntil != null && now.isBefore(openUntil);
    }
}
