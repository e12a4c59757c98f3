package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Economic kind of a transaction.
 *
 * Only SHARED transactions and settlements produce debt edges.
 */
public enum TransactionType {
    /**
     * Money received by the creator.
     */
    REVENUE("revenue"),

    /**
     * Money spent by the creator on their own behalf.
     */
    PERSONAL("personal"),

    /**
     * Cost split between several participants, paid by one or more payers.
     */
    SHARED("shared");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TransactionType fromValue(String value) {
        for (TransactionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }
}
