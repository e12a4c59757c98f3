package com.flagship.expense_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger change notification waiting in the outbox.
 *
 * Written in the same database transaction as the ledger write it describes, and
 * published to Kafka afterwards by {@link OutboxPublisher}. If the write rolls back,
 * so does the event.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Transaction" or "UserProfile"
    UUID aggregateId;          // Kafka key, keeps one transaction's events in order
    String eventType;          // e.g. "TransactionChanged"
    String payload;            // serialized LedgerChangeEvent
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(UUID id, String aggregateType, UUID aggregateId,
                                      String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
            createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once the publisher has given up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
