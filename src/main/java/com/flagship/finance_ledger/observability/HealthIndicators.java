package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.retry.CircuitBreakerRegistry;
import com.flagship.finance_ledger.retry.CircuitBreakerSnapshot;
import com.flagship.finance_ledger.runtime.EventStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Custom health indicators for the finance ledger.
 */
public class HealthIndicators {

    /**
     * Reports processors whose circuit is open. Open circuits degrade card payments
     * but leave the ledger itself usable, so the status is DEGRADED rather than DOWN.
     */
    @Component("circuitBreakers")
    public static class CircuitBreakerHealthIndicator implements HealthIndicator {

        private final CircuitBreakerRegistry circuitBreakers;

        public CircuitBreakerHealthIndicator(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
        }

        @Override
        public Health health() {
            List<CircuitBreakerSnapshot> open = circuitBreakers.openCircuits();
            if (open.isEmpty()) {
                return Health.up()
                        .withDetail("openCircuits", 0)
                        .build();
            }
            Map<String, String> details = open.stream()
                    .collect(Collectors.toMap(CircuitBreakerSnapshot::getProcessorKey,
                            s -> "open until " + s.getOpenUntil()));
            return Health.status("DEGRADED")
                    .withDetail("openCircuits", open.size())
                    .withDetails(details)
                    .build();
        }
    }

    /**
     * Health indicator for the event store. Unhealthy if it cannot be read.
     */
    @Component("eventStore")
    public static class EventStoreHealthIndicator implements HealthIndicator {

        private final EventStore eventStore;

        public EventStoreHealthIndicator(EventStore eventStore) {
            this.eventStore = eventStore;
        }

        @Override
        public Health health() {
            try {
                int fiscalYears = eventStore.keys("FiscalYear").size();
                return Health.up()
                        .withDetail("store", eventStore.getClass().getSimpleName())
                        .withDetail("fiscalYears", fiscalYears)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("store", eventStore.getClass().getSimpleName())
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
