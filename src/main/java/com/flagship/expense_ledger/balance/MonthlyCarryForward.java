package com.flagship.expense_ledger.balance;

import com.flagship.expense_ledger.transaction.Transaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Computes a user's chain of monthly balances from their transactions.
 *
 * For every month: revenue counts REVENUE transactions the user created, spent counts
 * PERSONAL transactions the user created plus what the user paid towards SHARED ones.
 * Months are chained in order, each opening at the previous closing (0 for the first).
 * The current month is always part of the chain, carried over unchanged when empty.
 *
 * Months are taken from the transaction date in UTC.
 */
@Component
public class MonthlyCarryForward {

    public List<MonthlyBalance> compute(UUID userId, List<Transaction> transactions, YearMonth currentMonth) {
        Map<YearMonth, Flow> flows = new TreeMap<>();
        flows.put(currentMonth, new Flow());

        for (Transaction tx : transactions) {
            if (tx.isDeleted()) {
                continue;
            }
            Flow flow = flows.computeIfAbsent(monthOf(tx), month -> new Flow());
            boolean createdByUser = tx.getUserId().equals(userId);
            switch (tx.getType()) {
                case REVENUE -> {
                    if (createdByUser) {
                        flow.revenue = flow.revenue.add(tx.getAmount());
                    }
                }
                case PERSONAL -> {
                    if (createdByUser) {
                        flow.spent = flow.spent.add(tx.getAmount());
                    }
                }
                case SHARED -> flow.spent = flow.spent.add(tx.amountPaidBy(userId));
            }
        }

        List<MonthlyBalance> chain = new ArrayList<>(flows.size());
        BigDecimal previousClosing = BigDecimal.ZERO;
        for (Map.Entry<YearMonth, Flow> entry : flows.entrySet()) {
            Flow flow = entry.getValue();
            BigDecimal closing = previousClosing.add(flow.revenue).subtract(flow.spent);
            chain.add(MonthlyBalance.of(userId, entry.getKey(), previousClosing, closing));
            previousClosing = closing;
        }
        return chain;
    }

    public static YearMonth monthOf(Transaction transaction) {
        return YearMonth.from(transaction.getDate().atZone(ZoneOffset.UTC));
    }

    private static final class Flow {
        private BigDecimal revenue = BigDecimal.ZERO;
        private BigDecimal spent = BigDecimal.ZERO;
    }
}
