package com.flagship.expense_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows: written only inside a write transaction, polled in order, retried and
 * eventually dead-lettered.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("expense_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("identity.profile-watch.enabled", () -> "false");
    }

    private static final int MAX_RETRIES = 3;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private OutboxEvent saveInTransaction(LedgerChangeEvent event) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(event));
    }

    private static LedgerChangeEvent transactionChanged() {
        return LedgerChangeEvent.transactionChanged(UUID.randomUUID(), LedgerChangeEvent.ChangeType.INSERT,
            Set.of(UUID.randomUUID(), UUID.randomUUID()), Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    @DisplayName("A saved event keeps the serialized change event as payload")
    void savedEventPayload() throws Exception {
        printTestHeader("Outbox payload");
        LedgerChangeEvent event = transactionChanged();

        OutboxEvent saved = saveInTransaction(event);

        assertEquals(event.eventId(), saved.getId());
        assertEquals("Transaction", saved.getAggregateType());
        assertEquals(event.aggregateId(), saved.getAggregateId());
        assertFalse(saved.isPublished());
        assertEquals(0, saved.getRetryCount());

        LedgerChangeEvent decoded = objectMapper.readValue(saved.getPayload(), LedgerChangeEvent.class);
        assertEquals(event, decoded);
        assertEquals(ChangeTable.TRANSACTIONS, decoded.table());
        printSuccess("Payload decodes to the original event");
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(transactionChanged()));
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Unpublished events come back in commit order and leave once published")
    void pollAndPublish() {
        printTestHeader("Poll in order");
        LedgerChangeEvent first = transactionChanged();
        LedgerChangeEvent second = LedgerChangeEvent.debtsChanged(first.aggregateId(),
            first.affectedUserIds(), first.occurredAt());
        saveInTransaction(first);
        saveInTransaction(second);

        List<OutboxEvent> batch = outboxService.findUnpublishedEvents(10, MAX_RETRIES);
        assertEquals(List.of(first.eventId(), second.eventId()), batch.stream().map(OutboxEvent::getId).toList());

        outboxService.markPublished(first.eventId());

        assertEquals(List.of(second.eventId()),
            outboxService.findUnpublishedEvents(10, MAX_RETRIES).stream().map(OutboxEvent::getId).toList());
        assertEquals(1, outboxService.countUnpublished());
        printSuccess("Published event no longer polled");
    }

    @Test
    @DisplayName("Failures are counted and the event is dead-lettered after the last retry")
    void deadLetter() {
        printTestHeader("Dead-lettering");
        LedgerChangeEvent event = transactionChanged();
        saveInTransaction(event);

        assertEquals(1, outboxService.markFailed(event.eventId(), "Broker not available"));
        assertEquals(2, outboxService.markFailed(event.eventId(), "Broker not available"));
        assertEquals(3, outboxService.markFailed(event.eventId(), "Broker not available"));

        OutboxEventEntity entity = repository.findById(event.eventId()).orElseThrow();
        assertEquals("Broker not available", entity.getLastError());
        assertTrue(entity.toDomain().isDeadLettered(MAX_RETRIES));
        assertTrue(outboxService.findUnpublishedEvents(10, MAX_RETRIES).isEmpty());
        assertEquals(1, repository.countDeadLettered(MAX_RETRIES));
        assertEquals(0, outboxService.markFailed(UUID.randomUUID(), "gone"));
        printSuccess("Event parked after " + MAX_RETRIES + " failures");
    }

    @Test
    @DisplayName("Profile changes are stored under the UserProfile aggregate")
    void profileAggregate() {
        UUID userId = UUID.randomUUID();
        OutboxEvent saved = saveInTransaction(LedgerChangeEvent.profileChanged(userId, Instant.now()));

        assertEquals("UserProfile", saved.getAggregateType());
        assertEquals(List.of(saved.getId()),
            outboxService.getEventsForAggregate(userId).stream().map(OutboxEvent::getId).toList());
    }
}
