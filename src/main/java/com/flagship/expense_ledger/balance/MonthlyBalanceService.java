package com.flagship.expense_ledger.balance;

import com.flagship.expense_ledger.ledger.LedgerStore;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.TransactionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Keeps the persisted monthly balances in step with the transactions.
 *
 * The whole chain of a user is recomputed on every write that touches them, so an
 * edit in an old month ripples into every later month. Recomputing is idempotent:
 * running it twice leaves the same rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyBalanceService {

    private final LedgerStore ledgerStore;
    private final MonthlyCarryForward carryForward;
    private final Clock clock;

    /**
     * Recomputes and stores the user's monthly chain.
     *
     * Must run inside the write transaction that changed the user's transactions.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<MonthlyBalance> recarryForward(UUID userId) {
        List<Transaction> transactions = ledgerStore.queryTransactions(userId, TransactionFilter.all());
        List<MonthlyBalance> chain = carryForward.compute(userId, transactions, YearMonth.now(clock));

        chain.forEach(ledgerStore::upsertMonthlyBalance);
        Set<YearMonth> months = chain.stream().map(MonthlyBalance::getMonth).collect(Collectors.toSet());
        int removed = ledgerStore.deleteMonthlyBalancesExcept(userId, months);

        log.debug("Recomputed {} monthly balances for user {} ({} stale months removed)",
                chain.size(), userId, removed);
        return chain;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recarryForward(Collection<UUID> userIds) {
        userIds.forEach(this::recarryForward);
    }

    @Transactional(readOnly = true)
    public Optional<MonthlyBalance> monthlyBalance(UUID userId, YearMonth month) {
        return ledgerStore.findMonthlyBalance(userId, month);
    }

    @Transactional(readOnly = true)
    public List<MonthlyBalance> monthlyBalances(UUID userId) {
        return ledgerStore.findMonthlyBalances(userId);
    }
}
