package com.flagship.expense_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * "debtor owes creditor amount" as a consequence of one transaction.
 *
 * Edges are derived data: they are only ever produced by {@link NettingEngine} and
 * replaced as a whole whenever their transaction changes.
 */
@Value
public class DebtEdge {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("debtor_id")
    UUID debtorId;

    @JsonProperty("creditor_id")
    UUID creditorId;

    @JsonProperty("amount")
    BigDecimal amount;

    public static DebtEdge of(UUID transactionId, UUID debtorId, UUID creditorId, BigDecimal amount) {
        if (debtorId.equals(creditorId)) {
            throw new IllegalArgumentException("Debtor and creditor must differ: " + debtorId);
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Debt amount must be positive: " + amount);
        }
        return new DebtEdge(transactionId, debtorId, creditorId, Amounts.round(amount));
    }

    public boolean involves(UUID userId) {
        return debtorId.equals(userId) || creditorId.equals(userId);
    }

    /**
     * The edge's effect on {@code userId}'s balance with the other side:
     * positive when the other side owes {@code userId}.
     */
    public BigDecimal signedFor(UUID userId) {
        if (creditorId.equals(userId)) {
            return amount;
        }
        if (debtorId.equals(userId)) {
            return amount.negate();
        }
        return BigDecimal.ZERO;
    }

    public UUID counterpartyOf(UUID userId) {
        return creditorId.equals(userId) ? debtorId : creditorId;
    }
}
