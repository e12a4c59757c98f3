package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.transaction.Transaction;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Authoritative state behind a transactions refresh.
 */
@Value
public class TransactionsSnapshot {
    List<Transaction> transactions;
    Map<UUID, UserProfile> profiles;
    List<MonthlyBalance> monthlyBalances;
}
