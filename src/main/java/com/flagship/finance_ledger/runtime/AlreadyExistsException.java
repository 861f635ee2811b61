package com.flagship.finance_ledger.runtime;

/**
 * Thrown when a create command targets an entity that has already been initialized.
 */
public class AlreadyExistsException extends IllegalStateException {

    public AlreadyExistsException(String message) {
        super(message);
    }
}
