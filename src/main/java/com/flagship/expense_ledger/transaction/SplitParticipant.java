package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A user who bears a share of a transaction's cost.
 * The percentage is only carried for percentage splits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitParticipant(
    @JsonProperty("user_id") UUID userId,
    @JsonProperty("share_amount") BigDecimal shareAmount,
    @JsonProperty("share_percentage") BigDecimal sharePercentage
) {

    public static SplitParticipant of(UUID userId, BigDecimal shareAmount) {
        return new SplitParticipant(userId, shareAmount, null);
    }
}
