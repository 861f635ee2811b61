package com.flagship.finance_ledger.retry;

/**
 * Circuit breaker state for one external processor.
 */
public enum CircuitState {
    CLOSED,     // Calls flow normally
    OPEN,       // Calls are refused until the open period expires
    HALF_OPEN   // One probe is allowed; its outcome closes or reopens the circuit
}
