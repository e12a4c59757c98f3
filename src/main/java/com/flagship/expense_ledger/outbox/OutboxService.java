package com.flagship.expense_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger change events to the outbox and tracks their publication.
 *
 * {@link #saveEvent} joins the caller's transaction, so an event exists if and only if
 * the ledger write it describes committed. Publishing happens later in
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Stores the event in the current transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         when called without an active transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerChangeEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.pending(
            event.eventId(),
            aggregateTypeOf(event.table()),
            event.aggregateId(),
            event.eventType(),
            serialize(event),
            event.occurredAt()
        );
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: eventId={}, type={}, aggregateId={}",
                event.eventId(), event.eventType(), event.aggregateId());
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch of unpublished events. Runs in its own transaction
     * so rows locked by another publisher instance are skipped, not waited on.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.lockNextBatch(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            repository.save(entity);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the retry count after this failure, or 0 if the event no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(UUID aggregateId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private static String aggregateTypeOf(ChangeTable table) {
        return table == ChangeTable.USER_PROFILES ? "UserProfile" : "Transaction";
    }

    private String serialize(LedgerChangeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger change event", e);
        }
    }
}
