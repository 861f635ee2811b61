package com.flagship.finance_ledger.payment;

import java.time.Duration;

/**
 * Waits between gateway retries. Tests substitute one that records instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
