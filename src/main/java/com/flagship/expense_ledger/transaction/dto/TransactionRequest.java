package com.flagship.expense_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_ledger.transaction.Category;
import com.flagship.expense_ledger.transaction.Payer;
import com.flagship.expense_ledger.transaction.PaymentMode;
import com.flagship.expense_ledger.transaction.SplitDetails;
import com.flagship.expense_ledger.transaction.TransactionDraft;
import com.flagship.expense_ledger.transaction.TransactionType;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Body of create and update requests.
 *
 * Required fields and ledger rules (sums, settlement consistency) are checked by the
 * transaction validator, so every violation is reported in one response.
 */
public record TransactionRequest(
    @JsonProperty("type") TransactionType type,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("payment_mode") PaymentMode paymentMode,
    @JsonProperty("description") @Size(max = 500, message = "Description is limited to 500 characters") String description,
    @JsonProperty("date") Instant date,
    @JsonProperty("category") Category category,
    @JsonProperty("payers") List<Payer> payers,
    @JsonProperty("split_details") SplitDetails splitDetails
) {

    public TransactionDraft toDraft() {
        return TransactionDraft.builder()
            .type(type)
            .amount(amount)
            .paymentMode(paymentMode)
            .description(description)
            .date(date)
            .category(category)
            .payers(payers)
            .splitDetails(splitDetails)
            .build();
    }
}
