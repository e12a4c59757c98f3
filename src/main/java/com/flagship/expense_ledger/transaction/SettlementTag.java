package com.flagship.expense_ledger.transaction;

import java.util.Optional;

/**
 * Reserved description prefix that marks a transaction as a settlement between two users.
 *
 * "SETTLEMENT: Paid bob@example.com" records that the creator paid Bob back (a PERSONAL
 * transaction), "SETTLEMENT: Received from bob@example.com" records that Bob paid the
 * creator (a REVENUE transaction).
 */
public record SettlementTag(Direction direction, String counterpartyEmail) {

    public static final String PREFIX = "SETTLEMENT:";

    public enum Direction {
        PAID("Paid ", TransactionType.PERSONAL),
        RECEIVED_FROM("Received from ", TransactionType.REVENUE);

        private final String marker;
        private final TransactionType expectedType;

        Direction(String marker, TransactionType expectedType) {
            this.marker = marker;
            this.expectedType = expectedType;
        }

        public TransactionType expectedType() {
            return expectedType;
        }
    }

    /**
     * True when the description starts with the reserved prefix, whether or not the rest parses.
     */
    public static boolean isTagged(String description) {
        return description != null && description.startsWith(PREFIX);
    }

    /**
     * Parses a tagged description. Returns empty when the prefix is missing or the
     * direction/email part is malformed.
     */
    public static Optional<SettlementTag> parse(String description) {
        if (!isTagged(description)) {
            return Optional.empty();
        }
        String rest = description.substring(PREFIX.length()).trim();
        for (Direction direction : Direction.values()) {
            if (rest.startsWith(direction.marker)) {
                String email = rest.substring(direction.marker.length()).trim();
                if (email.isEmpty() || email.contains(" ")) {
                    return Optional.empty();
                }
                return Optional.of(new SettlementTag(direction, email));
            }
        }
        return Optional.empty();
    }

    public static String describe(Direction direction, String counterpartyEmail) {
        return PREFIX + " " + direction.marker + counterpartyEmail;
    }

    public String description() {
        return describe(direction, counterpartyEmail);
    }
}
