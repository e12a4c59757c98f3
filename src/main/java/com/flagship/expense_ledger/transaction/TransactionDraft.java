package com.flagship.expense_ledger.transaction;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * The user-editable part of a transaction, as submitted for create or update.
 *
 * A draft is not trusted: it goes through {@code TransactionValidator} before it is
 * applied to a {@link Transaction}.
 */
@Value
@Builder(toBuilder = true)
public class TransactionDraft {
    TransactionType type;
    BigDecimal amount;
    PaymentMode paymentMode;
    String description;
    Instant date;
    Category category;
    List<Payer> payers;

    @With
    SplitDetails splitDetails;

    public List<Payer> getPayers() {
        return payers == null ? List.of() : payers;
    }
}
