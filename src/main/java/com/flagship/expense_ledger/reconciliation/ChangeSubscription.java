package com.flagship.expense_ledger.reconciliation;

/**
 * Handle of one registration with a {@link ChangeFeed}. Closing is idempotent.
 */
public interface ChangeSubscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
