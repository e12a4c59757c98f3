package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.ledger.FriendBalance;

import java.util.List;

/**
 * Callbacks of a {@link ReconciliationSession}. They run on the reconciliation scheduler.
 */
public interface ReconciliationListener {

    ReconciliationListener NONE = new ReconciliationListener() { };

    default void onTransactionsRefreshed(LocalLedgerView view) {
    }

    default void onFriendBalancesRefreshed(List<FriendBalance> balances) {
    }

    /**
     * The user's own write was applied to the view ahead of the next snapshot.
     */
    default void onLocalChange(LocalLedgerView view) {
    }

    default void onRefreshFailed(ReconciliationSession.RefreshKind kind, Throwable cause) {
    }

    /**
     * A subscription gave up; the view may be stale until the session is reopened.
     */
    default void onDegraded(ReconciliationException cause) {
    }
}
