package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.balance.MonthlyBalanceService;
import com.flagship.expense_ledger.ledger.DebtEdge;
import com.flagship.expense_ledger.ledger.FriendBalance;
import com.flagship.expense_ledger.ledger.FriendBalanceService;
import com.flagship.expense_ledger.ledger.LedgerStore;
import com.flagship.expense_ledger.outbox.OutboxEvent;
import com.flagship.expense_ledger.outbox.OutboxService;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import com.flagship.expense_ledger.transaction.exception.TransactionAccessDeniedException;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.flagship.expense_ledger.support.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The write path against a real database: row, edges, outbox events and monthly balances
 * commit together.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerWriteIntegrationTest {

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

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private FriendBalanceService friendBalanceService;

    @Autowired
    private MonthlyBalanceService monthlyBalanceService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private UUID alice;
    private UUID bob;
    private UUID carol;
    private UUID dave;
    private String aliceEmail;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM debts");
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM monthly_balances");
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM user_connections");
        jdbcTemplate.update("DELETE FROM user_profiles");

        alice = createUser("Alice");
        bob = createUser("Bob");
        carol = createUser("Carol");
        dave = createUser("Dave");
        aliceEmail = jdbcTemplate.queryForObject("SELECT email FROM user_profiles WHERE id = ?", String.class, alice);
        connect(alice, bob);
        connect(alice, carol);
    }

    private UUID createUser(String name) {
        UUID id = UUID.randomUUID();
        String email = name.toLowerCase() + "-" + id.toString().substring(0, 8) + "@example.com";
        jdbcTemplate.update("INSERT INTO user_profiles (id, email, display_name) VALUES (?, ?, ?)", id, email, name);
        return id;
    }

    private void connect(UUID requester, UUID addressee) {
        jdbcTemplate.update(
            "INSERT INTO user_connections (requester_id, addressee_id, status) VALUES (?, ?, 'accepted')",
            requester, addressee);
    }

    private Transaction dinnerPaidByAlice() {
        TransactionDraft draft = sharedDraft("90.00",
            List.of(payer(alice, "90.00")),
            List.of(share(alice, "30.00"), share(bob, "30.00"), share(carol, "30.00")));
        return transactionService.create(alice, draft, null).transaction();
    }

    private Map<UUID, BigDecimal> balancesOf(UUID user) {
        return friendBalanceService.balances(user).stream()
            .collect(Collectors.toMap(FriendBalance::getFriendId, FriendBalance::getBalance));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("Creating")
    class Creating {

        @Test
        @DisplayName("A shared transaction stores its edges and change events together")
        void atomicWrite() {
            printTestHeader("Atomic shared write");
            Transaction dinner = dinnerPaidByAlice();

            List<DebtEdge> edges = ledgerStore.findEdgesForTransaction(dinner.getId());
            assertEquals(2, edges.size());
            assertTrue(edges.stream().allMatch(edge -> edge.getCreditorId().equals(alice)));

            List<OutboxEvent> events = outboxService.getEventsForAggregate(dinner.getId());
            assertEquals(List.of(LedgerChangeEvent.TRANSACTION_CHANGED, LedgerChangeEvent.DEBTS_CHANGED),
                events.stream().map(OutboxEvent::getEventType).toList());

            Map<UUID, BigDecimal> balances = balancesOf(alice);
            assertEquals(money("30.00"), balances.get(bob));
            assertEquals(money("30.00"), balances.get(carol));
            assertEquals(money("-30.00"), balancesOf(bob).get(alice));
            printSuccess("Bob and Carol each owe Alice 30.00");
        }

        @Test
        @DisplayName("An invalid draft leaves no trace")
        void invalidDraftRejected() {
            printTestHeader("Rejected draft");
            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(alice, "100.00")),
                List.of(share(alice, "50.00"), share(bob, "40.00")));

            assertThrows(TransactionValidationException.class, () -> transactionService.create(alice, draft, null));

            assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
            assertEquals(0, outboxService.countUnpublished());
            printSuccess("No row, edge or event written");
        }

        @Test
        @DisplayName("Repeating an idempotency key returns the first transaction")
        void idempotentCreate() {
            printTestHeader("Idempotent create");
            TransactionDraft draft = personalDraft(alice, "12.00", NOW);

            TransactionService.CreateResult first = transactionService.create(alice, draft, "lunch-1");
            TransactionService.CreateResult second = transactionService.create(alice, draft, "lunch-1");

            assertTrue(first.created());
            assertFalse(second.created());
            assertEquals(first.transaction().getId(), second.transaction().getId());
            assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
            printSuccess("One transaction for two requests");
        }
    }

    @Nested
    @DisplayName("Editing and deleting")
    class EditingAndDeleting {

        @Test
        @DisplayName("A participant may edit; the activity log grows and edges are replaced")
        void participantEdit() {
            printTestHeader("Participant edit");
            Transaction dinner = dinnerPaidByAlice();
            TransactionDraft edit = sharedDraft("60.00",
                List.of(payer(alice, "60.00")),
                List.of(share(alice, "30.00"), share(bob, "30.00")));

            Transaction updated = transactionService.update(bob, dinner.getId(), edit);

            assertEquals(2, updated.getActivityLog().size());
            assertEquals(bob, updated.getActivityLog().get(1).userId());
            assertEquals(1, ledgerStore.findEdgesForTransaction(dinner.getId()).size());
            Map<UUID, BigDecimal> balances = balancesOf(alice);
            assertEquals(money("30.00"), balances.get(bob));
            assertEquals(money("0.00"), balances.get(carol));
            assertEquals(2, ledgerStore.findTransaction(dinner.getId()).orElseThrow().getActivityLog().size());
            printSuccess("Carol removed from the split, Bob still owes 30.00");
        }

        @Test
        @DisplayName("Someone not involved can neither edit nor delete")
        void outsiderDenied() {
            Transaction dinner = dinnerPaidByAlice();

            assertThrows(TransactionAccessDeniedException.class,
                () -> transactionService.update(dave, dinner.getId(), personalDraft(dave, "1.00", NOW)));
            assertThrows(TransactionAccessDeniedException.class,
                () -> transactionService.delete(dave, dinner.getId()));
            assertNull(ledgerStore.findTransaction(dinner.getId()).orElseThrow().getDeletedAt());
        }

        @Test
        @DisplayName("Deleting keeps a tombstone, clears the edges and blocks later edits")
        void softDelete() {
            printTestHeader("Soft delete");
            Transaction dinner = dinnerPaidByAlice();

            Transaction deleted = transactionService.delete(carol, dinner.getId());
            Transaction again = transactionService.delete(alice, dinner.getId());

            assertNotNull(deleted.getDeletedAt());
            assertNotNull(again.getDeletedAt());
            assertTrue(Duration.between(deleted.getDeletedAt(), again.getDeletedAt()).abs().toMillis() < 1,
                "Deleting twice keeps the first deletion time");
            assertEquals(2, ledgerStore.findTransaction(dinner.getId()).orElseThrow().getActivityLog().size());
            assertTrue(ledgerStore.findEdgesForTransaction(dinner.getId()).isEmpty());
            assertEquals(money("0.00"), balancesOf(alice).get(bob));
            assertThrows(IllegalStateException.class,
                () -> transactionService.update(alice, dinner.getId(), personalDraft(alice, "5.00", NOW)));
            printSuccess("Tombstone kept, balances back to zero");
        }
    }

    @Nested
    @DisplayName("Derived balances")
    class DerivedBalances {

        @Test
        @DisplayName("Paying back through a settlement brings the pair to zero")
        void settlementClearsDebt() {
            printTestHeader("Settlement");
            TransactionDraft lunch = sharedDraft("100.00",
                List.of(payer(alice, "100.00")),
                List.of(share(alice, "50.00"), share(bob, "50.00")));
            transactionService.create(alice, lunch, null);
            assertEquals(money("-50.00"), balancesOf(bob).get(alice));

            TransactionDraft payback = TransactionDraft.builder()
                .type(TransactionType.PERSONAL)
                .amount(money("50.00"))
                .paymentMode(PaymentMode.ONLINE)
                .description(SettlementTag.describe(SettlementTag.Direction.PAID, aliceEmail))
                .date(NOW)
                .payers(List.of(payer(bob, "50.00")))
                .build();
            Transaction settlement = transactionService.create(bob, payback, null).transaction();

            assertTrue(settlement.isSettlement());
            assertEquals(0, BigDecimal.ZERO.compareTo(friendBalanceService.balance(bob, alice)));
            printSuccess("Bob owes Alice nothing");
        }

        @Test
        @DisplayName("Editing an old month ripples into every later month")
        void carryForwardRipple() {
            printTestHeader("Carry-forward ripple");
            Transaction groceries = transactionService.create(alice,
                personalDraft(alice, "100.00", on("2025-01-10")), null).transaction();
            transactionService.create(alice, revenueDraft(alice, "300.00", on("2025-02-05")), null);

            MonthlyBalance february = monthlyBalanceService.monthlyBalance(alice, YearMonth.of(2025, 2)).orElseThrow();
            assertEquals(money("-100.00"), february.getOpeningBalance());
            assertEquals(money("200.00"), february.getClosingBalance());

            transactionService.update(alice, groceries.getId(), personalDraft(alice, "40.00", on("2025-01-10")));

            february = monthlyBalanceService.monthlyBalance(alice, YearMonth.of(2025, 2)).orElseThrow();
            MonthlyBalance march = monthlyBalanceService.monthlyBalance(alice, YearMonth.of(2025, 3)).orElseThrow();
            assertEquals(money("-40.00"), february.getOpeningBalance());
            assertEquals(money("260.00"), february.getClosingBalance());
            assertEquals(money("260.00"), march.getOpeningBalance());
            assertEquals(money("260.00"), march.getClosingBalance());
            printSuccess("February and the carried-over months follow the January edit");
        }
    }
}
