package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;

public interface ChangeListener {

    /**
     * Something changed. Delivery is at least once and events may arrive in bursts.
     */
    void onChange(LedgerChangeEvent event);

    /**
     * The subscription was dropped and will deliver nothing more.
     */
    void onSubscriptionError(Throwable cause);
}
