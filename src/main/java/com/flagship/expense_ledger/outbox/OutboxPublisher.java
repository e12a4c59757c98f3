package com.flagship.expense_ledger.outbox;

import com.flagship.expense_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes ledger change events to Kafka.
 *
 * Events are keyed by aggregate id so all events of one transaction land on the same
 * partition in commit order. Each send is awaited before the row is marked published;
 * a failed send bumps the retry count, and after {@code outbox.publisher.max-retries}
 * failures the event is dead-lettered (left unpublished and no longer polled).
 *
 * Delivery is at-least-once. Consumers deduplicate by event id.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-changes:ledger-changes}")
    private String ledgerChangesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            events.forEach(this::publish);
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(ledgerChangesTopic, event.getAggregateId().toString(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while publishing");
        } catch (Exception e) {
            recordFailure(event, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void recordFailure(OutboxEvent event, String reason) {
        int attempts = outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (attempts >= maxRetries) {
            log.error("Outbox event {} dead-lettered after {} attempts: eventType={}, aggregateId={}",
                    event.getId(), attempts, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
