package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.transaction.SettlementTag;
import com.flagship.expense_ledger.transaction.SplitParticipant;
import com.flagship.expense_ledger.transaction.Payer;
import com.flagship.expense_ledger.transaction.Transaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Derives the debt edges of a single transaction.
 *
 * Shared transactions:
 * 1. net[u] = paid by u - share of u
 * 2. nets within 0.01 of zero are dropped as rounding noise
 * 3. debtors (net < 0) are matched greedily against creditors (net > 0), both ordered
 *    by amount descending and then by user id, so the result is deterministic
 *
 * Settlements bypass the greedy match and produce exactly one edge between the creator
 * and the tagged counterparty.
 *
 * Deleted transactions, and transactions that are neither shared nor settlements,
 * produce no edges. The engine is pure: the same transaction always yields the same edges.
 */
@Component
public class NettingEngine {

    private static final Comparator<Position> LARGEST_FIRST =
        Comparator.comparing(Position::getRemaining).reversed()
            .thenComparing(Position::getUserId);

    public List<DebtEdge> recompute(Transaction transaction) {
        if (transaction.isDeleted()) {
            return List.of();
        }
        if (transaction.isSettlement()) {
            return settlementEdge(transaction);
        }
        if (!transaction.isShared() || transaction.getSplitDetails() == null) {
            return List.of();
        }
        return greedyMatch(transaction.getId(), netPositions(transaction));
    }

    /**
     * Net position per user: what they paid minus what they owe. Duplicate entries
     * for the same user are summed.
     */
    Map<UUID, BigDecimal> netPositions(Transaction transaction) {
        Map<UUID, BigDecimal> net = new LinkedHashMap<>();
        for (Payer payer : transaction.getPayers()) {
            net.merge(payer.userId(), payer.amountPaid(), BigDecimal::add);
        }
        for (SplitParticipant participant : transaction.getSplitDetails().participants()) {
            net.merge(participant.userId(), participant.shareAmount().negate(), BigDecimal::add);
        }
        return net;
    }

    private List<DebtEdge> greedyMatch(UUID transactionId, Map<UUID, BigDecimal> net) {
        List<Position> debtors = new ArrayList<>();
        List<Position> creditors = new ArrayList<>();
        net.forEach((userId, amount) -> {
            if (Amounts.isNegligible(amount)) {
                return;
            }
            if (amount.signum() < 0) {
                debtors.add(new Position(userId, amount.negate()));
            } else {
                creditors.add(new Position(userId, amount));
            }
        });
        debtors.sort(LARGEST_FIRST);
        creditors.sort(LARGEST_FIRST);

        List<DebtEdge> edges = new ArrayList<>();
        int d = 0;
        int c = 0;
        while (d < debtors.size() && c < creditors.size()) {
            Position debtor = debtors.get(d);
            Position creditor = creditors.get(c);
            BigDecimal transfer = debtor.getRemaining().min(creditor.getRemaining());

            BigDecimal rounded = Amounts.round(transfer);
            if (rounded.compareTo(Amounts.EPSILON) > 0) {
                edges.add(DebtEdge.of(transactionId, debtor.getUserId(), creditor.getUserId(), rounded));
            }

            debtor.reduceBy(transfer);
            creditor.reduceBy(transfer);
            if (Amounts.isNegligible(creditor.getRemaining())) {
                c++;
            }
            if (Amounts.isNegligible(debtor.getRemaining())) {
                d++;
            }
        }
        return edges;
    }

    private List<DebtEdge> settlementEdge(Transaction transaction) {
        UUID creator = transaction.getUserId();
        UUID counterparty = transaction.settlementCounterparty().orElseThrow();
        SettlementTag tag = transaction.settlementTag().orElseThrow();
        BigDecimal amount = transaction.getAmount();

        // "Paid X" offsets what the creator owed X, so it is recorded as X owing the creator.
        return switch (tag.direction()) {
            case PAID -> List.of(DebtEdge.of(transaction.getId(), counterparty, creator, amount));
            case RECEIVED_FROM -> List.of(DebtEdge.of(transaction.getId(), creator, counterparty, amount));
        };
    }

    private static final class Position {
        private final UUID userId;
        private BigDecimal remaining;

        private Position(UUID userId, BigDecimal remaining) {
            this.userId = userId;
            this.remaining = remaining;
        }

        UUID getUserId() {
            return userId;
        }

        BigDecimal getRemaining() {
            return remaining;
        }

        void reduceBy(BigDecimal amount) {
            remaining = remaining.subtract(amount);
        }
    }
}
