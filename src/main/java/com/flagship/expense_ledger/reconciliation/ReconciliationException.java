package com.flagship.expense_ledger.reconciliation;

/**
 * A change feed subscription could not be established or was dropped.
 *
 * Never reaches callers of a session: the session retries and, once out of attempts,
 * reports the exception through {@link ReconciliationListener#onDegraded}.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
