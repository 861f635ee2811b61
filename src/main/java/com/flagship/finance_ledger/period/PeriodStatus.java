package com.flagship.finance_ledger.period;

/**
 * Status of one accounting period.
 *
 * NOT_STARTED -> OPEN -> CLOSED -> LOCKED. CLOSED -> OPEN (reopen) is the only way back,
 * and a LOCKED period never changes again.
 */
public enum PeriodStatus {
    NOT_STARTED,
    OPEN,
    CLOSED,
    LOCKED
}
