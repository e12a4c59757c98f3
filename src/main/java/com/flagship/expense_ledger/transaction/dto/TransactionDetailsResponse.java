package com.flagship.expense_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.ledger.DebtEdge;
import com.flagship.expense_ledger.transaction.TransactionQueryService.TransactionDetails;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A transaction together with the people involved and the debts it creates.
 */
@Value
@Builder
public class TransactionDetailsResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("participants")
    List<UserProfile> participants;

    @JsonProperty("debts")
    List<DebtEdge> debts;

    public static TransactionDetailsResponse from(TransactionDetails details) {
        return TransactionDetailsResponse.builder()
            .transaction(TransactionResponse.from(details.transaction()))
            .participants(details.transaction().involvedUserIds().stream()
                .map(details.profiles()::get)
                .filter(profile -> profile != null)
                .toList())
            .debts(details.edges())
            .build();
    }
}
