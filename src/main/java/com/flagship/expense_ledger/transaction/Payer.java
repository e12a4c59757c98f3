package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A user who paid part of a transaction's amount.
 */
public record Payer(
    @JsonProperty("user_id") UUID userId,
    @JsonProperty("amount_paid") BigDecimal amountPaid
) {
}
