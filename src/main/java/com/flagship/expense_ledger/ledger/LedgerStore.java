package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.TransactionFilter;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence for transactions, their debt edges and the monthly balances derived from them.
 *
 * Implementations take part in the caller's Spring transaction; callers that write several
 * things (transaction row, edges, balances) wrap them in one {@code @Transactional} method
 * so they commit or roll back together.
 */
public interface LedgerStore {

    /**
     * Inserts the transaction, or updates every mutable column if it already exists.
     * Creator, creation time and idempotency key are never overwritten.
     *
     * @param idempotencyKey key supplied on create, may be null
     */
    Transaction upsertTransaction(Transaction transaction, String idempotencyKey);

    Optional<Transaction> findTransaction(UUID transactionId);

    /**
     * Like {@link #findTransaction} but locks the row until the surrounding transaction
     * ends, so concurrent edits of one transaction apply one after the other.
     */
    Optional<Transaction> findTransactionForUpdate(UUID transactionId);

    Optional<Transaction> findTransactionByIdempotencyKey(String idempotencyKey);

    /**
     * Transactions where the user is creator, payer or split participant, newest first.
     */
    List<Transaction> queryTransactions(UUID userId, TransactionFilter filter);

    /**
     * Deletes every edge of the transaction and inserts {@code edges} in their place.
     */
    void replaceEdges(UUID transactionId, List<DebtEdge> edges);

    List<DebtEdge> findEdgesForTransaction(UUID transactionId);

    /**
     * Every edge where the user is debtor or creditor.
     */
    List<DebtEdge> queryEdges(UUID userId);

    void upsertMonthlyBalance(MonthlyBalance balance);

    /**
     * Removes the user's monthly rows for months not in {@code keep}.
     *
     * @return number of rows removed
     */
    int deleteMonthlyBalancesExcept(UUID userId, Set<YearMonth> keep);

    Optional<MonthlyBalance> findMonthlyBalance(UUID userId, YearMonth month);

    /**
     * All monthly rows of the user, oldest month first.
     */
    List<MonthlyBalance> findMonthlyBalances(UUID userId);
}
