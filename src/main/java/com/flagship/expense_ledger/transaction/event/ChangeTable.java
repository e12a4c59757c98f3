package com.flagship.expense_ledger.transaction.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ledger tables whose changes are broadcast to subscribed sessions.
 */
public enum ChangeTable {
    TRANSACTIONS("transactions"),
    DEBTS("debts"),
    USER_PROFILES("user_profiles");

    private final String tableName;

    ChangeTable(String tableName) {
        this.tableName = tableName;
    }

    @JsonValue
    public String tableName() {
        return tableName;
    }

    @JsonCreator
    public static ChangeTable fromTableName(String tableName) {
        for (ChangeTable table : values()) {
            if (table.tableName.equals(tableName)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown change table: " + tableName);
    }
}
