package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.ledger.FriendBalance;

import java.util.List;
import java.util.UUID;

/**
 * Where a session fetches authoritative state from.
 */
public interface LedgerSnapshotSource {

    TransactionsSnapshot fetchTransactions(UUID userId);

    List<FriendBalance> fetchFriendBalances(UUID userId);
}
