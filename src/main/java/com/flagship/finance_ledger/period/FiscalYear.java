package com.flagship.finance_ledger.period;

import com.flagship.finance_ledger.period.event.FiscalYearEvent;
import com.flagship.finance_ledger.period.event.FiscalYearInitializedEvent;
import com.flagship.finance_ledger.period.event.PeriodClosedEvent;
import com.flagship.finance_ledger.period.event.PeriodLockedEvent;
import com.flagship.finance_ledger.period.event.PeriodOpenedEvent;
import com.flagship.finance_ledger.period.event.PeriodReopenedEvent;
import com.flagship.finance_ledger.period.event.YearEndClosedEvent;
import com.flagship.finance_ledger.runtime.AlreadyExistsException;
import com.flagship.finance_ledger.runtime.EventSourcedEntity;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * The accounting periods of one organization's fiscal year.
 *
 * Rules enforced:
 * 1. A period opens only after its predecessor has been opened at least once
 * 2. Locking is a sequential ratchet: period n locks only when 1..n-1 are closed or locked
 * 3. A closed period can be reopened unless a later period is locked
 * 4. Year-end close requires every period closed, then locks them all; it is permanent
 *
 * The fiscal year is labelled by the calendar year in which it starts.
 */
public class FiscalYear extends EventSourcedEntity<FiscalYearEvent> {

    private static final DateTimeFormatter MONTH_NAME = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private boolean initialized;
    private int year;
    private PeriodFrequency frequency;
    private int startMonth;
    private final List<Period> periods = new ArrayList<>();
    private boolean yearClosed;
    private Instant yearClosedAt;
    private String yearClosedBy;
    private String retainedEarningsAccountCode;

    // ==================== Commands ====================

    public void initialize(int year, PeriodFrequency frequency, int startMonth, String performedBy, Instant now) {
        if (initialized) {
            throw new AlreadyExistsException("Fiscal year " + year + " already initialized");
        }
        if (frequency == null) {
            throw new IllegalArgumentException("Period frequency is required");
        }
        if (startMonth < 1 || startMonth > 12) {
            throw new IllegalArgumentException("Start month must be between 1 and 12: " + startMonth);
        }

        List<Period> generated = new ArrayList<>();
        YearMonth first = YearMonth.of(year, startMonth);
        int months = frequency.getMonthsPerPeriod();
        for (int n = 1; n <= frequency.getPeriodsPerYear(); n++) {
            YearMonth start = first.plusMonths((long) (n - 1) * months);
            YearMonth end = start.plusMonths(months - 1L);
            generated.add(Period.notStarted(n, periodName(frequency, n, start, year),
                start.atDay(1), end.atEndOfMonth()));
        }

        raise(new FiscalYearInitializedEvent(year, frequency, startMonth, generated, performedBy, now));
    }

    public Period openPeriod(int number, String performedBy, Instant now) {
        Period period = requirePeriod(number);
        switch (period.getStatus()) {
            case OPEN -> throw new IllegalStateException(String.format("Period %d is already open", number));
            case LOCKED -> throw new IllegalStateException(
                String.format("Period %d is locked and cannot be opened", number));
            case NOT_STARTED -> {
                if (number > 1 && periods.get(number - 2).getStatus() == PeriodStatus.NOT_STARTED) {
                    throw new IllegalStateException(String.format(
                        "Cannot open period %d before opening period %d", number, number - 1));
                }
            }
            case CLOSED -> {
                // Opening a closed period is a reopen without a recorded reason
                requireNoLaterLocked(number, "open");
            }
        }
        raise(new PeriodOpenedEvent(number, performedBy, now));
        return periods.get(number - 1);
    }

    public Period closePeriod(int number, boolean force, String performedBy, Instant now) {
        Period period = requirePeriod(number);
        switch (period.getStatus()) {
            case CLOSED -> throw new IllegalStateException(String.format("Period %d is already closed", number));
            case LOCKED -> throw new IllegalStateException(String.format("Period %d is locked", number));
            case NOT_STARTED -> {
                if (!force) {
                    throw new IllegalStateException(String.format(
                        "Period %d was never opened. Use force=true to close it anyway.", number));
                }
            }
            case OPEN -> {
                // Normal close
            }
        }
        raise(new PeriodClosedEvent(number, period.getStatus() == PeriodStatus.NOT_STARTED, performedBy, now));
        return periods.get(number - 1);
    }

    public Period lockPeriod(int number, String performedBy, Instant now) {
        Period period = requirePeriod(number);
        if (period.getStatus() == PeriodStatus.LOCKED) {
            throw new IllegalStateException(String.format("Period %d is already locked", number));
        }
        if (period.getStatus() != PeriodStatus.CLOSED) {
            throw new IllegalStateException(String.format("Period %d must be closed first", number));
        }
        for (Period earlier : periods.subList(0, number - 1)) {
            if (!earlier.closedOrLocked()) {
                throw new IllegalStateException(String.format(
                    "Cannot lock period %d: prior period %d still closing (%s)",
                    number, earlier.getNumber(), earlier.getStatus()));
            }
        }
        raise(new PeriodLockedEvent(number, performedBy, now));
        return periods.get(number - 1);
    }

    public Period reopenPeriod(int number, String reason, String performedBy, Instant now) {
        Period period = requirePeriod(number);
        if (period.getStatus() == PeriodStatus.LOCKED) {
            throw new IllegalStateException(String.format("Period %d is locked and cannot be reopened", number));
        }
        if (period.getStatus() != PeriodStatus.CLOSED) {
            throw new IllegalStateException(String.format(
                "Only closed periods can be reopened (period %d is %s)", number, period.getStatus()));
        }
        requireNoLaterLocked(number, "reopen");
        raise(new PeriodReopenedEvent(number, reason, performedBy, now));
        return periods.get(number - 1);
    }

    /**
     * Locks every period and closes the year. Closing entries against retained earnings
     * are posted by the caller before this is invoked.
     */
    public FiscalYearSummary yearEndClose(String retainedEarningsAccountCode, String performedBy, Instant now) {
        requireInitialized();
        if (retainedEarningsAccountCode == null || retainedEarningsAccountCode.isBlank()) {
            throw new IllegalArgumentException("Retained earnings account code is required");
        }
        if (yearClosed) {
            throw new IllegalStateException(String.format("Fiscal year %d is already closed", year));
        }
        List<Period> unclosed = periods.stream().filter(p -> !p.closedOrLocked()).toList();
        if (!unclosed.isEmpty()) {
            String listed = unclosed.stream()
                .map(p -> p.getNumber() + " (" + p.getStatus() + ")")
                .collect(Collectors.joining(", "));
            throw new IllegalStateException(String.format(
                "Cannot close fiscal year %d: unclosed periods %s", year, listed));
        }
        raise(new YearEndClosedEvent(retainedEarningsAccountCode, performedBy, now));
        return getSummary();
    }

    // ==================== Queries ====================

    public boolean exists() {
        return initialized;
    }

    public boolean isYearClosed() {
        requireInitialized();
        return yearClosed;
    }

    public boolean canPostToDate(LocalDate date) {
        if (!initialized || yearClosed) {
            return false;
        }
        return getPeriodForDate(date)
            .map(p -> p.getStatus() == PeriodStatus.OPEN)
            .orElse(false);
    }

    public Optional<Period> getPeriodForDate(LocalDate date) {
        requireInitialized();
        return periods.stream().filter(p -> p.contains(date)).findFirst();
    }

    public Period getPeriod(int number) {
        return requirePeriod(number);
    }

    public List<Period> getAllPeriods() {
        requireInitialized();
        return List.copyOf(periods);
    }

    public Optional<Period> getCurrentOpenPeriod() {
        requireInitialized();
        return periods.stream().filter(p -> p.getStatus() == PeriodStatus.OPEN).findFirst();
    }

    public FiscalYearSummary getSummary() {
        requireInitialized();
        return FiscalYearSummary.builder()
            .year(year)
            .frequency(frequency)
            .startMonth(startMonth)
            .startDate(periods.get(0).getStartDate())
            .endDate(periods.get(periods.size() - 1).getEndDate())
            .totalPeriods(periods.size())
            .notStartedPeriods(count(PeriodStatus.NOT_STARTED))
            .openPeriods(count(PeriodStatus.OPEN))
            .closedPeriods(count(PeriodStatus.CLOSED))
            .lockedPeriods(count(PeriodStatus.LOCKED))
            .currentOpenPeriod(getCurrentOpenPeriod().map(Period::getNumber).orElse(null))
            .yearClosed(yearClosed)
            .yearClosedAt(yearClosedAt)
            .yearClosedBy(yearClosedBy)
            .retainedEarningsAccountCode(retainedEarningsAccountCode)
            .build();
    }

    // ==================== Event application ====================

    @Override
    protected void apply(FiscalYearEvent event) {
        if (event instanceof FiscalYearInitializedEvent e) {
            initialized = true;
            year = e.getYear();
            frequency = e.getFrequency();
            startMonth = e.getStartMonth();
            periods.clear();
            periods.addAll(e.getPeriods());
        } else if (event instanceof PeriodOpenedEvent e) {
            replace(e.getPeriodNumber(), p -> p.open(e.getPerformedBy(), e.getOccurredAt(), null));
        } else if (event instanceof PeriodReopenedEvent e) {
            replace(e.getPeriodNumber(), p -> p.open(e.getPerformedBy(), e.getOccurredAt(), e.getReason()));
        } else if (event instanceof PeriodClosedEvent e) {
            replace(e.getPeriodNumber(), p -> p.close(e.getPerformedBy(), e.getOccurredAt()));
        } else if (event instanceof PeriodLockedEvent e) {
            replace(e.getPeriodNumber(), p -> p.lock(e.getPerformedBy(), e.getOccurredAt()));
        } else if (event instanceof YearEndClosedEvent e) {
            for (int i = 0; i < periods.size(); i++) {
                Period period = periods.get(i);
                if (period.getStatus() != PeriodStatus.LOCKED) {
                    periods.set(i, period.lock(e.getPerformedBy(), e.getOccurredAt()));
                }
            }
            yearClosed = true;
            yearClosedAt = e.getOccurredAt();
            yearClosedBy = e.getPerformedBy();
            retainedEarningsAccountCode = e.getRetainedEarningsAccountCode();
        }
    }

    // ==================== Helpers ====================

    private void replace(int number, UnaryOperator<Period> transition) {
        periods.set(number - 1, transition.apply(periods.get(number - 1)));
    }

    private Period requirePeriod(int number) {
        requireInitialized();
        if (number < 1 || number > periods.size()) {
            throw new IllegalArgumentException(String.format(
                "Period %d does not exist (fiscal year %d has %d periods)", number, year, periods.size()));
        }
        return periods.get(number - 1);
    }

    private void requireNoLaterLocked(int number, String action) {
        for (Period later : periods.subList(number, periods.size())) {
            if (later.getStatus() == PeriodStatus.LOCKED) {
                throw new IllegalStateException(String.format(
                    "Cannot %s period %d: later period %d is locked", action, number, later.getNumber()));
            }
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Fiscal year not initialized");
        }
    }

    private int count(PeriodStatus status) {
        return (int) periods.stream().filter(p -> p.getStatus() == status).count();
    }

    private static String periodName(PeriodFrequency frequency, int number, YearMonth start, int fiscalYear) {
        return switch (frequency) {
            case MONTHLY -> String.format("Period %d (%s)", number, start.format(MONTH_NAME));
            case QUARTERLY -> String.format("Q%d %d", number, fiscalYear);
            case YEARLY -> String.format("FY %d", fiscalYear);
        };
    }
}
