package com.flagship.finance_ledger.period;

import com.flagship.finance_ledger.runtime.AlreadyExistsException;
import com.flagship.finance_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fiscal year and period lifecycle tests.
 *
 * These tests verify that:
 * - Periods are generated for the chosen frequency and start month
 * - Periods open in order and lock as a sequential ratchet
 * - Year-end close requires every period closed and locks them all
 * - Posting is allowed only into open periods of an open year
 */
class AccountingPeriodServiceTest {

    private LedgerFixture fx;
    private AccountingPeriodService periods;
    private UUID org;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture(Instant.parse("2024-01-02T09:00:00Z"));
        periods = fx.periods;
        org = fx.organizationId;
    }

    @Test
    @DisplayName("Quarterly year: open and close all, year-end close locks every period")
    void testQuarterlyYearEndClose() {
        printTestHeader("Quarterly Year-End Close");

        periods.initializeFiscalYear(org, 2024, PeriodFrequency.QUARTERLY, 1, LedgerFixture.USER);
        for (int q = 1; q <= 4; q++) {
            periods.openPeriod(org, 2024, q, LedgerFixture.USER);
            periods.closePeriod(org, 2024, q, LedgerFixture.USER);
        }

        FiscalYearSummary summary = periods.yearEndClose(org, 2024, "3000", LedgerFixture.USER);
        printOutput("Summary", summary);

        assertTrue(periods.isYearClosed(org, 2024));
        assertEquals(4, summary.getLockedPeriods());
        assertEquals("3000", summary.getRetainedEarningsAccountCode());
        assertFalse(periods.canPostToDate(org, LocalDate.of(2024, 1, 1)));
        assertFalse(periods.canPostToDate(org, LocalDate.of(2024, 12, 31)));

        IllegalStateException again = assertThrows(IllegalStateException.class,
            () -> periods.yearEndClose(org, 2024, "3000", LedgerFixture.USER));
        printExpectedException("IllegalStateException", again.getMessage());
        assertEquals("Fiscal year 2024 is already closed", again.getMessage());
        printSuccess("Year closed and locked");
    }

    @Test
    @DisplayName("Periods are generated per frequency with names and date ranges")
    void testPeriodGeneration() {
        printTestHeader("Period Generation");

        periods.initializeFiscalYear(org, 2024, PeriodFrequency.MONTHLY, 7, LedgerFixture.USER);
        List<Period> all = periods.getAllPeriods(org, 2024);
        printOutput("First", all.get(0));
        printOutput("Last", all.get(11));

        assertEquals(12, all.size());
        assertEquals("Period 1 (Jul 2024)", all.get(0).getName());
        assertEquals(LocalDate.of(2024, 7, 1), all.get(0).getStartDate());
        assertEquals(LocalDate.of(2025, 6, 30), all.get(11).getEndDate());
        assertEquals(LocalDate.of(2025, 2, 28), all.get(7).getEndDate());
        assertTrue(all.stream().allMatch(p -> p.getStatus() == PeriodStatus.NOT_STARTED));

        periods.initializeFiscalYear(org, 2023, PeriodFrequency.QUARTERLY, 1, LedgerFixture.USER);
        assertEquals("Q3 2023", periods.getPeriod(org, 2023, 3).getName());
        periods.initializeFiscalYear(org, 2022, PeriodFrequency.YEARLY, 1, LedgerFixture.USER);
        assertEquals("FY 2022", periods.getPeriod(org, 2022, 1).getName());

        assertThrows(AlreadyExistsException.class,
            () -> periods.initializeFiscalYear(org, 2024, PeriodFrequency.MONTHLY, 1, LedgerFixture.USER));
        assertThrows(IllegalArgumentException.class,
            () -> periods.initializeFiscalYear(org, 2021, PeriodFrequency.MONTHLY, 13, LedgerFixture.USER));
    }

    @Test
    @DisplayName("Periods open in order")
    void testOpenInOrder() {
        printTestHeader("Open In Order");
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.MONTHLY, 1, LedgerFixture.USER);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> periods.openPeriod(org, 2024, 3, LedgerFixture.USER));
        printExpectedException("IllegalStateException", exception.getMessage());
        assertEquals("Cannot open period 3 before opening period 2", exception.getMessage());

        periods.openPeriod(org, 2024, 1, LedgerFixture.USER);
        assertThrows(IllegalStateException.class, () -> periods.openPeriod(org, 2024, 1, LedgerFixture.USER));
        assertEquals(1, periods.getCurrentOpenPeriod(org, 2024).orElseThrow().getNumber());
    }

    @Test
    @DisplayName("A never-opened period closes only with force")
    void testForceClose() {
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.QUARTERLY, 1, LedgerFixture.USER);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> periods.closePeriod(org, 2024, 1, LedgerFixture.USER));
        printExpectedException("IllegalStateException", exception.getMessage());

        Period closed = periods.closePeriod(org, 2024, 1, true, LedgerFixture.USER);
        assertEquals(PeriodStatus.CLOSED, closed.getStatus());
    }

    @Test
    @DisplayName("Locking is a sequential ratchet")
    void testLockRatchet() {
        printTestHeader("Lock Ratchet");
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.QUARTERLY, 1, LedgerFixture.USER);
        periods.openPeriod(org, 2024, 1, LedgerFixture.USER);
        periods.openPeriod(org, 2024, 2, LedgerFixture.USER);
        periods.closePeriod(org, 2024, 2, LedgerFixture.USER);

        IllegalStateException priorOpen = assertThrows(IllegalStateException.class,
            () -> periods.lockPeriod(org, 2024, 2, LedgerFixture.USER));
        printExpectedException("IllegalStateException", priorOpen.getMessage());
        assertTrue(priorOpen.getMessage().contains("prior period 1 still closing"));

        IllegalStateException notClosed = assertThrows(IllegalStateException.class,
            () -> periods.lockPeriod(org, 2024, 1, LedgerFixture.USER));
        assertEquals("Period 1 must be closed first", notClosed.getMessage());

        periods.closePeriod(org, 2024, 1, LedgerFixture.USER);
        periods.lockPeriod(org, 2024, 2, LedgerFixture.USER);

        IllegalStateException reopen = assertThrows(IllegalStateException.class,
            () -> periods.reopenPeriod(org, 2024, 1, "Late invoice", LedgerFixture.USER));
        printExpectedException("IllegalStateException", reopen.getMessage());
        assertTrue(reopen.getMessage().contains("later period 2 is locked"));

        IllegalStateException lockedReopen = assertThrows(IllegalStateException.class,
            () -> periods.reopenPeriod(org, 2024, 2, "Late invoice", LedgerFixture.USER));
        assertEquals("Period 2 is locked and cannot be reopened", lockedReopen.getMessage());
        printSuccess("Ratchet enforced");
    }

    @Test
    @DisplayName("Closed period can be reopened with a reason")
    void testReopen() {
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.MONTHLY, 1, LedgerFixture.USER);
        periods.openPeriod(org, 2024, 1, LedgerFixture.USER);
        periods.closePeriod(org, 2024, 1, LedgerFixture.USER);
        assertFalse(periods.canPostToDate(org, LocalDate.of(2024, 1, 20)));

        Period reopened = periods.reopenPeriod(org, 2024, 1, "Late invoice", LedgerFixture.USER);

        assertEquals(PeriodStatus.OPEN, reopened.getStatus());
        assertEquals("Late invoice", reopened.getNotes());
        assertTrue(periods.canPostToDate(org, LocalDate.of(2024, 1, 20)));
        assertThrows(IllegalStateException.class,
            () -> periods.reopenPeriod(org, 2024, 2, "Not closed", LedgerFixture.USER));
    }

    @Test
    @DisplayName("Year-end close is refused while a period is unclosed")
    void testYearEndCloseWithOpenPeriod() {
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.QUARTERLY, 1, LedgerFixture.USER);
        periods.openPeriod(org, 2024, 1, LedgerFixture.USER);
        periods.closePeriod(org, 2024, 1, LedgerFixture.USER);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> periods.yearEndClose(org, 2024, "3000", LedgerFixture.USER));
        printExpectedException("IllegalStateException", exception.getMessage());
        assertTrue(exception.getMessage().startsWith("Cannot close fiscal year 2024: unclosed periods"));
        assertThrows(IllegalArgumentException.class,
            () -> periods.yearEndClose(org, 2024, " ", LedgerFixture.USER));
    }

    @Test
    @DisplayName("A date is postable through the fiscal year that started the year before")
    void testCanPostAcrossCalendarYears() {
        periods.initializeFiscalYear(org, 2024, PeriodFrequency.MONTHLY, 7, LedgerFixture.USER);
        for (int n = 1; n <= 8; n++) {
            periods.openPeriod(org, 2024, n, LedgerFixture.USER);
        }

        assertTrue(periods.canPostToDate(org, LocalDate.of(2025, 2, 14)));
        assertFalse(periods.canPostToDate(org, LocalDate.of(2025, 3, 14)));
        assertFalse(periods.canPostToDate(org, LocalDate.of(2026, 1, 1)));
        assertEquals(8, periods.getPeriodForDate(org, 2024, LocalDate.of(2025, 2, 14)).orElseThrow().getNumber());
    }
}
