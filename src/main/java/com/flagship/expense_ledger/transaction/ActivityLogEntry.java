package com.flagship.expense_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.UUID;

/**
 * One audit record in a transaction's append-only activity log.
 */
public record ActivityLogEntry(
    @JsonProperty("action") Action action,
    @JsonProperty("user_id") UUID userId,
    @JsonProperty("user_name") String userName,
    @JsonProperty("timestamp") Instant timestamp
) {

    public enum Action {
        CREATED("created"),
        UPDATED("updated"),
        DELETED("deleted");

        private final String value;

        Action(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static Action fromValue(String value) {
            for (Action action : values()) {
                if (action.value.equalsIgnoreCase(value)) {
                    return action;
                }
            }
            throw new IllegalArgumentException("Unknown activity action: " + value);
        }
    }
}
