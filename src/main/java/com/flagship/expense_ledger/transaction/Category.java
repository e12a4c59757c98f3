package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Spending category. Optional on every transaction.
 */
public enum Category {
    RENT,
    FOOD,
    SOCIAL,
    TRANSPORT,
    APPAREL,
    BEAUTY,
    EDUCATION,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Category fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Category.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
