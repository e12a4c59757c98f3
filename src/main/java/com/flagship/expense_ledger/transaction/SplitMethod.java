package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the cost of a transaction is divided between participants.
 */
public enum SplitMethod {
    EQUALLY("equally"),
    PERCENTAGES("percentages"),

    /**
     * Reserved for settlements: the only participant is the counterparty.
     */
    SETTLEMENT("settlement");

    private final String value;

    SplitMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SplitMethod fromValue(String value) {
        for (SplitMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown split method: " + value);
    }
}
