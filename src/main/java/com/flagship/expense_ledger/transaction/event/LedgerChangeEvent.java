package com.flagship.expense_ledger.transaction.event;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Notification that a ledger row changed.
 *
 * Events are facts about committed writes: they are stored in the outbox together with
 * the write and carry no data beyond what a subscriber needs to decide whether to refresh.
 * {@code affectedUserIds} lists everyone whose view of the ledger may have changed; an
 * empty set means everyone.
 */
public record LedgerChangeEvent(
    UUID eventId,
    String eventType,
    ChangeTable table,
    ChangeType changeType,
    UUID aggregateId,
    Set<UUID> affectedUserIds,
    Instant occurredAt
) {

    public static final String TRANSACTION_CHANGED = "TransactionChanged";
    public static final String DEBTS_CHANGED = "DebtsChanged";
    public static final String PROFILE_CHANGED = "ProfileChanged";

    public enum ChangeType {
        INSERT,
        UPDATE,
        DELETE
    }

    public LedgerChangeEvent {
        affectedUserIds = affectedUserIds == null ? Set.of() : Set.copyOf(affectedUserIds);
    }

    public static LedgerChangeEvent transactionChanged(UUID transactionId, ChangeType changeType,
                                                       Set<UUID> affectedUserIds, Instant occurredAt) {
        return new LedgerChangeEvent(UUID.randomUUID(), TRANSACTION_CHANGED, ChangeTable.TRANSACTIONS,
            changeType, transactionId, affectedUserIds, occurredAt);
    }

    public static LedgerChangeEvent debtsChanged(UUID transactionId, Set<UUID> affectedUserIds,
                                                 Instant occurredAt) {
        return new LedgerChangeEvent(UUID.randomUUID(), DEBTS_CHANGED, ChangeTable.DEBTS,
            ChangeType.UPDATE, transactionId, affectedUserIds, occurredAt);
    }

    public static LedgerChangeEvent profileChanged(UUID userId, Instant occurredAt) {
        return new LedgerChangeEvent(UUID.randomUUID(), PROFILE_CHANGED, ChangeTable.USER_PROFILES,
            ChangeType.UPDATE, userId, Set.of(), occurredAt);
    }

    /**
     * True when a session of {@code userId} should react to this event.
     */
    public boolean concerns(UUID userId) {
        return affectedUserIds.isEmpty() || affectedUserIds.contains(userId);
    }
}
