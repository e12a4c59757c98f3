package com.flagship.expense_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.reconciliation.InProcessChangeFeed;
import com.flagship.expense_ledger.reconciliation.ReconciliationException;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.event.ConsumerStartedEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Feeds ledger change events from Kafka into the in-process change feed.
 *
 * Every instance hosts its own reconciliation sessions and therefore needs every event,
 * so the consumer group is per instance (see {@code ledger.change-feed.group-id}).
 * Offsets are acknowledged manually after the event was handed to the feed; duplicates
 * are dropped by the processed-events table.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LedgerChangeConsumer {

    private final IdempotentEventProcessor eventProcessor;
    private final InProcessChangeFeed changeFeed;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    @Getter
    private final String consumerGroup;

    @Value("${consumer.processed-events.retention-days:7}")
    private int retentionDays;

    public LedgerChangeConsumer(IdempotentEventProcessor eventProcessor,
                                InProcessChangeFeed changeFeed,
                                ObjectMapper objectMapper,
                                LedgerMetrics metrics,
                                @Value("${ledger.change-feed.group-id:expense-ledger-change-feed}") String consumerGroup) {
        this.eventProcessor = eventProcessor;
        this.changeFeed = changeFeed;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.consumerGroup = consumerGroup;
    }

    @KafkaListener(
        topics = "${kafka.topic.ledger-changes:ledger-changes}",
        groupId = "#{__listener.consumerGroup}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        LedgerChangeEvent event = parseEvent(record.value());
        if (event == null) {
            log.warn("Could not parse change event at offset {}, acknowledging to skip", record.offset());
            metrics.recordEventConsumed("unparseable", "skipped");
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(event);
            ack.acknowledge();
            metrics.recordEventConsumed(event.eventType(), processed ? "processed" : "duplicate");
        } catch (RuntimeException e) {
            log.error("Error processing change event {} at offset {}: {}",
                    event.eventId(), record.offset(), e.getMessage(), e);
            metrics.recordEventConsumed(event.eventType(), "failed");
            // not acknowledged, the record is redelivered
            throw e;
        }
    }

    private boolean route(LedgerChangeEvent event) {
        return switch (event.eventType()) {
            case LedgerChangeEvent.TRANSACTION_CHANGED,
                 LedgerChangeEvent.DEBTS_CHANGED,
                 LedgerChangeEvent.PROFILE_CHANGED -> eventProcessor.processEvent(event, consumerGroup, () -> {
                    int delivered = changeFeed.publish(event);
                    log.debug("Delivered {} for aggregate {} to {} subscriptions",
                            event.eventType(), event.aggregateId(), delivered);
                });
            default -> {
                log.debug("Unknown event type: {}, skipping", event.eventType());
                eventProcessor.skipEvent(event, consumerGroup, "Unknown event type");
                yield false;
            }
        };
    }

    /**
     * @return null when the payload is not a change event
     */
    private LedgerChangeEvent parseEvent(String json) {
        try {
            LedgerChangeEvent event = objectMapper.readValue(json, LedgerChangeEvent.class);
            if (event.eventId() == null || event.eventType() == null || event.aggregateId() == null) {
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse change event: {}", e.getMessage());
            return null;
        }
    }

    /**
     * A listener container that stops for any reason but a normal shutdown leaves the
     * sessions without notifications; they are told so and start resubscribing.
     */
    @EventListener
    public void onConsumerStopped(ConsumerStoppedEvent event) {
        if (event.getReason() == ConsumerStoppedEvent.Reason.NORMAL) {
            return;
        }
        log.error("Change event consumer stopped abnormally: {}", event.getReason());
        changeFeed.interrupt(new ReconciliationException("Change event consumer stopped: " + event.getReason()));
    }

    @EventListener
    public void onConsumerStarted(ConsumerStartedEvent event) {
        changeFeed.resume();
    }

    @Scheduled(cron = "${consumer.processed-events.cleanup-cron:0 30 3 * * *}")
    public void purgeProcessedEvents() {
        eventProcessor.purgeProcessedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
    }
}
