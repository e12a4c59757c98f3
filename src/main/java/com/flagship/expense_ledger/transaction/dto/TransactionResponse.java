package com.flagship.expense_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_ledger.transaction.ActivityLogEntry;
import com.flagship.expense_ledger.transaction.Category;
import com.flagship.expense_ledger.transaction.Payer;
import com.flagship.expense_ledger.transaction.PaymentMode;
import com.flagship.expense_ledger.transaction.SplitDetails;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @JsonProperty("description")
    String description;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("category")
    Category category;

    @JsonProperty("payers")
    List<Payer> payers;

    @JsonProperty("split_details")
    SplitDetails splitDetails;

    @JsonProperty("activity_log")
    List<ActivityLogEntry> activityLog;

    @JsonProperty("settlement")
    boolean settlement;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .userId(transaction.getUserId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .paymentMode(transaction.getPaymentMode())
            .description(transaction.getDescription())
            .date(transaction.getDate())
            .category(transaction.getCategory())
            .payers(transaction.getPayers())
            .splitDetails(transaction.getSplitDetails())
            .activityLog(transaction.getActivityLog())
            .settlement(transaction.isSettlement())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .deletedAt(transaction.getDeletedAt())
            .build();
    }
}
