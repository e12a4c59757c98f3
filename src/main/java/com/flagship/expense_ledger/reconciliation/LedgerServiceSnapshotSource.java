package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.balance.MonthlyCarryForward;
import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.ledger.FriendBalance;
import com.flagship.expense_ledger.ledger.FriendBalanceService;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.TransactionFilter;
import com.flagship.expense_ledger.transaction.TransactionQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reads snapshots straight from the ledger services of this instance.
 *
 * The monthly chain is recomputed from the fetched transactions rather than read from
 * monthly_balances, so it is consistent with the transaction list it is shown next to.
 */
@Component
@RequiredArgsConstructor
public class LedgerServiceSnapshotSource implements LedgerSnapshotSource {

    private final TransactionQueryService queryService;
    private final UserDirectory userDirectory;
    private final MonthlyCarryForward carryForward;
    private final FriendBalanceService friendBalanceService;
    private final Clock clock;

    @Override
    public TransactionsSnapshot fetchTransactions(UUID userId) {
        List<Transaction> transactions = queryService.list(userId, TransactionFilter.all());

        Set<UUID> involved = new LinkedHashSet<>();
        involved.add(userId);
        transactions.forEach(tx -> involved.addAll(tx.involvedUserIds()));
        Map<UUID, UserProfile> profiles = userDirectory.findByIds(involved);

        List<MonthlyBalance> monthlyBalances =
            carryForward.compute(userId, transactions, YearMonth.now(clock));

        return new TransactionsSnapshot(transactions, profiles, monthlyBalances);
    }

    @Override
    public List<FriendBalance> fetchFriendBalances(UUID userId) {
        return friendBalanceService.balances(userId);
    }
}
