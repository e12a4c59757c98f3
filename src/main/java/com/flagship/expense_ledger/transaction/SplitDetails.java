package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Cost allocation of a shared transaction, or the counterparty of a settlement.
 */
public record SplitDetails(
    @JsonProperty("method") SplitMethod method,
    @JsonProperty("participants") List<SplitParticipant> participants
) {

    public SplitDetails {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    /**
     * Split details of a settlement: one participant, the counterparty, bearing the full amount.
     */
    public static SplitDetails settlement(UUID counterpartyId, BigDecimal amount) {
        return new SplitDetails(SplitMethod.SETTLEMENT, List.of(SplitParticipant.of(counterpartyId, amount)));
    }
}
