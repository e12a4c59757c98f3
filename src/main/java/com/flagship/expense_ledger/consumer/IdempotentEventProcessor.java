package com.flagship.expense_ledger.consumer;

import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Runs a handler at most once per change event and consumer group.
 *
 * The processed_events row is written in the same transaction as the check, so a
 * redelivery after a crash either sees the row or repeats the whole unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(LedgerChangeEvent event, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(event.eventId(), consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    event.eventId(), consumerGroup);
            return false;
        }

        try {
            handler.run();

            recordProcessed(ProcessedEvent.success(
                event.eventId(), event.eventType(), aggregateTypeOf(event), event.aggregateId(), consumerGroup
            ));

            log.debug("Processed event {} by consumer group {}", event.eventId(), consumerGroup);
            return true;

        } catch (RuntimeException e) {
            recordProcessed(ProcessedEvent.failed(
                event.eventId(), event.eventType(), aggregateTypeOf(event), event.aggregateId(), consumerGroup,
                e.getMessage()
            ));

            log.error("Failed to process event {} by consumer group {}: {}",
                    event.eventId(), consumerGroup, e.getMessage(), e);

            // rethrown so the offset is not committed and Kafka redelivers
            throw e;
        }
    }

    /**
     * Records an event this consumer does not handle, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(LedgerChangeEvent event, String consumerGroup, String reason) {
        if (isAlreadyProcessed(event.eventId(), consumerGroup)) {
            return;
        }

        recordProcessed(ProcessedEvent.skipped(
            event.eventId(), event.eventType(), aggregateTypeOf(event), event.aggregateId(), consumerGroup, reason
        ));

        log.debug("Skipped event {} by consumer group {}: {}", event.eventId(), consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    /**
     * @return number of records removed
     */
    @Transactional
    public int purgeProcessedBefore(Instant cutoff) {
        int removed = repository.deleteEventsProcessedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} processed event records older than {}", removed, cutoff);
        }
        return removed;
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }

    private static String aggregateTypeOf(LedgerChangeEvent event) {
        if (event.table() == null) {
            return "Unknown";
        }
        return event.table() == ChangeTable.USER_PROFILES ? "UserProfile" : "Transaction";
    }
}
