package com.flagship.finance_ledger.support;

import com.flagship.finance_ledger.chart.ChartAccount;
import com.flagship.finance_ledger.chart.InMemoryChartOfAccounts;
import com.flagship.finance_ledger.journal.JournalEntryService;
import com.flagship.finance_ledger.ledger.AccountLedgerService;
import com.flagship.finance_ledger.ledger.AccountType;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.period.AccountingPeriodService;
import com.flagship.finance_ledger.period.PeriodFrequency;
import com.flagship.finance_ledger.period.YearEndCloseService;
import com.flagship.finance_ledger.runtime.EntityRuntime;
import com.flagship.finance_ledger.runtime.EventStore;
import com.flagship.finance_ledger.runtime.InMemoryEventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Wires the ledger services over an in-memory event store for one test organization.
 */
public class LedgerFixture {

    public static final String USER = "accountant@test";

    public final UUID organizationId = UUID.randomUUID();
    public final MutableClock clock;
    public final EventStore eventStore = new InMemoryEventStore();
    public final EntityRuntime runtime = new EntityRuntime();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LedgerMetrics metrics = new LedgerMetrics(meterRegistry);
    public final InMemoryChartOfAccounts chart = new InMemoryChartOfAccounts();
    public final AccountLedgerService ledgers;
    public final AccountingPeriodService periods;
    public final JournalEntryService journals;
    public final YearEndCloseService yearEnd;

    public LedgerFixture(Instant start) {
        this.clock = new MutableClock(start);
        this.ledgers = new AccountLedgerService(eventStore, runtime, clock, metrics);
        this.periods = new AccountingPeriodService(eventStore, runtime, clock, metrics);
        this.journals = new JournalEntryService(eventStore, runtime, ledgers, periods, chart, clock, metrics);
        this.yearEnd = new YearEndCloseService(periods, ledgers, chart);
    }

    /**
     * Creates the account ledger and registers it in the chart under {@code code}.
     */
    public UUID account(String code, String name, AccountType type) {
        return account(code, name, type, BigDecimal.ZERO);
    }

    public UUID account(String code, String name, AccountType type, BigDecimal openingBalance) {
        UUID accountId = UUID.randomUUID();
        ledgers.createAccount(organizationId, accountId, code, name, type, "USD", openingBalance, false, USER);
        chart.register(organizationId, new ChartAccount(code, accountId, name, type, null, true));
        return accountId;
    }

    /**
     * Initializes a monthly fiscal year starting in January with every month opened.
     */
    public void openCalendarYear(int year) {
        periods.initializeFiscalYear(organizationId, year, PeriodFrequency.MONTHLY, 1, USER);
        for (int n = 1; n <= 12; n++) {
            periods.openPeriod(organizationId, year, n, USER);
        }
    }

    public BigDecimal balance(UUID accountId) {
        return ledgers.getBalance(organizationId, accountId);
    }
}
