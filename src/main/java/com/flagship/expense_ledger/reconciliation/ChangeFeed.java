package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.transaction.event.ChangeTable;

import java.util.UUID;

/**
 * Source of change notifications for one table, filtered to what concerns a user.
 */
public interface ChangeFeed {

    /**
     * @throws ReconciliationException if the feed cannot accept subscriptions right now
     */
    ChangeSubscription subscribe(UUID userId, ChangeTable table, ChangeListener listener);
}
