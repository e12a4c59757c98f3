package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.ledger.FriendBalance;
import com.flagship.expense_ledger.transaction.Transaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A session's cached copy of the ledger.
 *
 * Local writes are applied optimistically. The next authoritative snapshot replaces the
 * cached transactions wholesale; nothing is merged.
 */
public class LocalLedgerView {

    private static final Comparator<Transaction> NEWEST_FIRST = Comparator
        .comparing(Transaction::getDate, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(Transaction::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<UUID, Transaction> transactions = new LinkedHashMap<>();
    private Map<UUID, UserProfile> profiles = Map.of();
    private List<MonthlyBalance> monthlyBalances = List.of();
    private List<FriendBalance> friendBalances = List.of();
    private int unconfirmedChanges;

    public synchronized void applyLocalCreate(Transaction transaction) {
        transactions.put(transaction.getId(), transaction);
        unconfirmedChanges++;
    }

    public synchronized void applyLocalUpdate(Transaction transaction) {
        transactions.put(transaction.getId(), transaction);
        unconfirmedChanges++;
    }

    /**
     * Marks the cached transaction deleted. Unknown ids are ignored.
     *
     * @return true if a cached transaction was marked
     */
    public synchronized boolean applyLocalDelete(UUID transactionId, Instant deletedAt) {
        Transaction cached = transactions.get(transactionId);
        if (cached == null || cached.isDeleted()) {
            return false;
        }
        transactions.put(transactionId, cached.toBuilder().deletedAt(deletedAt).build());
        unconfirmedChanges++;
        return true;
    }

    public synchronized void replaceTransactions(TransactionsSnapshot snapshot) {
        transactions.clear();
        snapshot.getTransactions().forEach(tx -> transactions.put(tx.getId(), tx));
        profiles = Map.copyOf(snapshot.getProfiles());
        monthlyBalances = List.copyOf(snapshot.getMonthlyBalances());
        unconfirmedChanges = 0;
    }

    public synchronized void replaceFriendBalances(List<FriendBalance> balances) {
        friendBalances = List.copyOf(balances);
    }

    /**
     * Live transactions, newest first.
     */
    public synchronized List<Transaction> getTransactions() {
        List<Transaction> visible = new ArrayList<>();
        for (Transaction tx : transactions.values()) {
            if (!tx.isDeleted()) {
                visible.add(tx);
            }
        }
        visible.sort(NEWEST_FIRST);
        return visible;
    }

    public synchronized Optional<Transaction> findTransaction(UUID transactionId) {
        return Optional.ofNullable(transactions.get(transactionId));
    }

    public synchronized Map<UUID, UserProfile> getProfiles() {
        return profiles;
    }

    public synchronized List<MonthlyBalance> getMonthlyBalances() {
        return monthlyBalances;
    }

    public synchronized List<FriendBalance> getFriendBalances() {
        return friendBalances;
    }

    /**
     * Local changes applied since the last authoritative snapshot.
     */
    public synchronized int getUnconfirmedChanges() {
        return unconfirmedChanges;
    }
}
