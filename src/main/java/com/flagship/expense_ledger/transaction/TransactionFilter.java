package com.flagship.expense_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional restrictions for transaction queries. Null fields do not restrict.
 */
@Value
@Builder
public class TransactionFilter {
    Instant from;
    Instant to;
    TransactionType type;
    boolean includeDeleted;

    public static TransactionFilter all() {
        return TransactionFilter.builder().build();
    }

    public static TransactionFilter includingDeleted() {
        return TransactionFilter.builder().includeDeleted(true).build();
    }
}
