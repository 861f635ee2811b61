package com.flagship.finance_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.chart.ChartOfAccounts;
import com.flagship.finance_ledger.chart.InMemoryChartOfAccounts;
import com.flagship.finance_ledger.payment.PaymentGateway;
import com.flagship.finance_ledger.payment.Sleeper;
import com.flagship.finance_ledger.payment.UnconfiguredPaymentGateway;
import com.flagship.finance_ledger.runtime.EventStore;
import com.flagship.finance_ledger.runtime.InMemoryEventStore;
import com.flagship.finance_ledger.runtime.JdbcEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Infrastructure beans for the ledger core.
 *
 * ledger.persistence.mode selects the event store: "memory" (default) keeps events in
 * the process, "jdbc" stores them in the entity_events table.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.persistence.mode", havingValue = "memory", matchIfMissing = true)
    public EventStore inMemoryEventStore() {
        log.info("Using in-memory event store; state is lost on restart");
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.persistence.mode", havingValue = "jdbc")
    public EventStore jdbcEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        log.info("Using JDBC event store");
        return new JdbcEventStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ChartOfAccounts.class)
    public InMemoryChartOfAccounts chartOfAccounts() {
        return new InMemoryChartOfAccounts();
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentGateway paymentGateway() {
        log.warn("No PaymentGateway bean registered; card charges will be declined");
        return new UnconfiguredPaymentGateway();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
