package com.flagship.expense_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a change event handled by one consumer group.
 *
 * Kafka delivers at least once; the record lets a redelivered event be recognised and
 * dropped instead of being fanned out to the sessions a second time.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType,
                                        String aggregateType, UUID aggregateId,
                                        String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
