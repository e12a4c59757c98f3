package com.flagship.expense_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One transaction's contribution to the balance between two users.
 */
@Value
public class BalanceBreakdownEntry {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("description")
    String description;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("settlement")
    boolean settlement;

    /**
     * Positive when the friend owes the user because of this transaction.
     */
    @JsonProperty("amount")
    BigDecimal amount;
}
