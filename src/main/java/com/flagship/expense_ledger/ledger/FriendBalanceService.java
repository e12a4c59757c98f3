package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregates debt edges into per-friend balances.
 *
 * Balances are never stored: they are summed from the committed edge set on every read,
 * so they can never drift from the transactions that produced them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FriendBalanceService {

    private static final Comparator<FriendBalance> BY_NAME =
        Comparator.comparing((FriendBalance b) -> b.getFriendName().toLowerCase())
            .thenComparing(FriendBalance::getFriendId);

    private final LedgerStore ledgerStore;
    private final UserDirectory userDirectory;

    /**
     * One entry per counterparty sharing at least one edge with the user, plus a zero
     * entry for every accepted friend without edges.
     */
    @Transactional(readOnly = true)
    public List<FriendBalance> balances(UUID userId) {
        Map<UUID, BigDecimal> totals = new LinkedHashMap<>();
        for (DebtEdge edge : ledgerStore.queryEdges(userId)) {
            totals.merge(edge.counterpartyOf(userId), edge.signedFor(userId), BigDecimal::add);
        }

        Map<UUID, UserProfile> profiles = new LinkedHashMap<>();
        for (UserProfile friend : userDirectory.findFriends(userId)) {
            profiles.put(friend.id(), friend);
            totals.putIfAbsent(friend.id(), BigDecimal.ZERO);
        }
        List<UUID> unknown = totals.keySet().stream().filter(id -> !profiles.containsKey(id)).toList();
        profiles.putAll(userDirectory.findByIds(unknown));

        List<FriendBalance> balances = new ArrayList<>(totals.size());
        totals.forEach((friendId, total) -> balances.add(toFriendBalance(friendId, total, profiles.get(friendId))));
        balances.sort(BY_NAME);

        log.debug("Computed {} friend balances for user {}", balances.size(), userId);
        return balances;
    }

    /**
     * Net balance between two users. Positive: {@code friendId} owes {@code userId}.
     */
    @Transactional(readOnly = true)
    public BigDecimal balance(UUID userId, UUID friendId) {
        BigDecimal total = ledgerStore.queryEdges(userId).stream()
            .filter(edge -> edge.involves(friendId))
            .map(edge -> edge.signedFor(userId))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Amounts.round(total);
    }

    /**
     * The transactions behind the balance between two users, newest first.
     */
    @Transactional(readOnly = true)
    public List<BalanceBreakdownEntry> breakdown(UUID userId, UUID friendId) {
        Map<UUID, BigDecimal> perTransaction = new LinkedHashMap<>();
        for (DebtEdge edge : ledgerStore.queryEdges(userId)) {
            if (edge.involves(friendId)) {
                perTransaction.merge(edge.getTransactionId(), edge.signedFor(userId), BigDecimal::add);
            }
        }

        List<BalanceBreakdownEntry> entries = new ArrayList<>(perTransaction.size());
        perTransaction.forEach((transactionId, amount) -> {
            Optional<Transaction> transaction = ledgerStore.findTransaction(transactionId);
            if (transaction.isEmpty()) {
                log.warn("Debt edge references missing transaction {}", transactionId);
                return;
            }
            Transaction tx = transaction.get();
            entries.add(new BalanceBreakdownEntry(
                tx.getId(), tx.getDescription(), tx.getDate(), tx.isSettlement(), Amounts.round(amount)));
        });
        entries.sort(Comparator.comparing(BalanceBreakdownEntry::getDate,
            Comparator.nullsLast(Comparator.reverseOrder())));
        return entries;
    }

    private FriendBalance toFriendBalance(UUID friendId, BigDecimal total, UserProfile profile) {
        String name = profile != null ? profile.name() : "Unknown";
        String email = profile != null ? profile.email() : null;
        return new FriendBalance(friendId, name, email, Amounts.round(total));
    }
}
