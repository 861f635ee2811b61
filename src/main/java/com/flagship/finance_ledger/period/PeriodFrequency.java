package com.flagship.finance_ledger.period;

public enum PeriodFrequency {
    MONTHLY(12),
    QUARTERLY(4),
    YEARLY(1);

    private final int periodsPerYear;

    PeriodFrequency(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    public int getMonthsPerPeriod() {
        return 12 / periodsPerYear;
    }
}
