package com.flagship.finance_ledger.period;

import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.period.event.FiscalYearEvent;
import com.flagship.finance_ledger.runtime.EntityRepository;
import com.flagship.finance_ledger.runtime.EntityRuntime;
import com.flagship.finance_ledger.runtime.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Service for fiscal-year period management, addressed by organization and fiscal year.
 *
 * Also answers whether a date is postable. A date belongs to the fiscal year that starts
 * in its own calendar year or the year before, so both are consulted.
 */
@Service
@Slf4j
public class AccountingPeriodService {

    static final String ENTITY_TYPE = "FiscalYear";

    private final EntityRepository<FiscalYear, FiscalYearEvent> fiscalYears;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public AccountingPeriodService(EventStore eventStore, EntityRuntime runtime, Clock clock, LedgerMetrics metrics) {
        this.fiscalYears = new EntityRepository<>(ENTITY_TYPE, FiscalYearEvent.class,
            FiscalYear::new, eventStore, runtime);
        this.clock = clock;
        this.metrics = metrics;
    }

    public FiscalYearSummary initializeFiscalYear(UUID organizationId, int year, PeriodFrequency frequency,
                                                  int startMonth, String performedBy) {
        FiscalYearSummary summary = command(organizationId, year, fy -> {
            fy.initialize(year, frequency, startMonth, performedBy, now());
            return fy.getSummary();
        });
        log.info("Fiscal year {} initialized: frequency={}, startMonth={}, periods={}",
            year, frequency, startMonth, summary.getTotalPeriods());
        return summary;
    }

    public Period openPeriod(UUID organizationId, int year, int periodNumber, String performedBy) {
        Period period = command(organizationId, year, fy -> fy.openPeriod(periodNumber, performedBy, now()));
        logTransition(year, period);
        return period;
    }

    public Period closePeriod(UUID organizationId, int year, int periodNumber, String performedBy) {
        return closePeriod(organizationId, year, periodNumber, false, performedBy);
    }

    public Period closePeriod(UUID organizationId, int year, int periodNumber, boolean force, String performedBy) {
        Period period = command(organizationId, year, fy -> fy.closePeriod(periodNumber, force, performedBy, now()));
        if (force) {
            log.warn("Period {} of fiscal year {} force-closed by {}", periodNumber, year, performedBy);
        }
        logTransition(year, period);
        return period;
    }

    public Period lockPeriod(UUID organizationId, int year, int periodNumber, String performedBy) {
        Period period = command(organizationId, year, fy -> fy.lockPeriod(periodNumber, performedBy, now()));
        logTransition(year, period);
        return period;
    }

    public Period reopenPeriod(UUID organizationId, int year, int periodNumber, String reason, String performedBy) {
        Period period = command(organizationId, year,
            fy -> fy.reopenPeriod(periodNumber, reason, performedBy, now()));
        log.info("Period {} of fiscal year {} reopened by {}: {}", periodNumber, year, performedBy, reason);
        metrics.recordPeriodTransition("REOPENED");
        return period;
    }

    /**
     * Locks all periods of the year and closes it permanently. Does not post closing
     * entries; {@link YearEndCloseService} does that first.
     */
    public FiscalYearSummary yearEndClose(UUID organizationId, int year, String retainedEarningsAccountCode,
                                          String performedBy) {
        FiscalYearSummary summary = command(organizationId, year,
            fy -> fy.yearEndClose(retainedEarningsAccountCode, performedBy, now()));
        log.info("Fiscal year {} closed by {}: lockedPeriods={}, retainedEarnings={}",
            year, performedBy, summary.getLockedPeriods(), retainedEarningsAccountCode);
        metrics.recordPeriodTransition("YEAR_CLOSED");
        return summary;
    }

    // ==================== Queries ====================

    public boolean canPostToDate(UUID organizationId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        for (int year : new int[] {date.getYear(), date.getYear() - 1}) {
            Optional<Boolean> answer = query(organizationId, year, fy -> {
                if (!fy.exists() || fy.getPeriodForDate(date).isEmpty()) {
                    return Optional.<Boolean>empty();
                }
                return Optional.of(fy.canPostToDate(date));
            });
            if (answer.isPresent()) {
                return answer.get();
            }
        }
        return false;
    }

    public Optional<Period> getPeriodForDate(UUID organizationId, int year, LocalDate date) {
        return query(organizationId, year, fy -> fy.getPeriodForDate(date));
    }

    public Period getPeriod(UUID organizationId, int year, int periodNumber) {
        return query(organizationId, year, fy -> fy.getPeriod(periodNumber));
    }

    public List<Period> getAllPeriods(UUID organizationId, int year) {
        return query(organizationId, year, FiscalYear::getAllPeriods);
    }

    public Optional<Period> getCurrentOpenPeriod(UUID organizationId, int year) {
        return query(organizationId, year, FiscalYear::getCurrentOpenPeriod);
    }

    public FiscalYearSummary getSummary(UUID organizationId, int year) {
        return query(organizationId, year, FiscalYear::getSummary);
    }

    public boolean isYearClosed(UUID organizationId, int year) {
        return query(organizationId, year, FiscalYear::isYearClosed);
    }

    public boolean exists(UUID organizationId, int year) {
        return query(organizationId, year, FiscalYear::exists);
    }

    // ==================== Helpers ====================

    private <R> R command(UUID organizationId, int year, Function<FiscalYear, R> command) {
        String org = requireOrganization(organizationId);
        return CorrelationContext.withContext(org,
            () -> fiscalYears.execute(org, String.valueOf(year), command));
    }

    private <R> R query(UUID organizationId, int year, Function<FiscalYear, R> query) {
        return fiscalYears.query(requireOrganization(organizationId), String.valueOf(year), query);
    }

    private void logTransition(int year, Period period) {
        log.info("Period {} ({}) of fiscal year {} is now {}", period.getNumber(), period.getName(), year,
            period.getStatus());
        metrics.recordPeriodTransition(period.getStatus().name());
    }

    private Instant now() {
        return clock.instant();
    }

    private static String requireOrganization(UUID organizationId) {
        if (organizationId == null) {
            throw new IllegalArgumentException("Organization ID is required");
        }
        return organizationId.toString();
    }
}
