package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.transaction.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.expense_ledger.support.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FriendBalanceServiceTest {

    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final UUID CAROL = UUID.fromString("00000000-0000-0000-0000-00000000000c");
    private static final UUID DAVE = UUID.fromString("00000000-0000-0000-0000-00000000000d");

    private static final UserProfile BOB_PROFILE = new UserProfile(BOB, "bob@example.com", "Bob");
    private static final UserProfile CAROL_PROFILE = new UserProfile(CAROL, "carol@example.com", null);
    private static final UserProfile DAVE_PROFILE = new UserProfile(DAVE, "dave@example.com", "Dave");

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private UserDirectory userDirectory;

    @InjectMocks
    private FriendBalanceService service;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Edges are summed per friend and friends without edges show zero")
    void balancesPerFriend() {
        printTestHeader("Friend balances");
        UUID dinner = UUID.randomUUID();
        UUID taxi = UUID.randomUUID();
        UUID lunch = UUID.randomUUID();
        when(ledgerStore.queryEdges(ALICE)).thenReturn(List.of(
            DebtEdge.of(dinner, BOB, ALICE, money("50.00")),
            DebtEdge.of(taxi, ALICE, BOB, money("20.00")),
            DebtEdge.of(lunch, CAROL, ALICE, money("10.00"))));
        when(userDirectory.findFriends(ALICE)).thenReturn(List.of(BOB_PROFILE, DAVE_PROFILE));
        when(userDirectory.findByIds(List.of(CAROL))).thenReturn(Map.of(CAROL, CAROL_PROFILE));

        List<FriendBalance> balances = service.balances(ALICE);

        assertEquals(List.of(
            new FriendBalance(BOB, "Bob", "bob@example.com", money("30.00")),
            new FriendBalance(CAROL, "carol", "carol@example.com", money("10.00")),
            new FriendBalance(DAVE, "Dave", "dave@example.com", money("0.00"))
        ), balances);
        printSuccess("Bob owes 30, Carol owes 10, Dave is settled");
    }

    @Test
    @DisplayName("A user without edges or friends has no balances")
    void noBalances() {
        when(ledgerStore.queryEdges(ALICE)).thenReturn(List.of());
        when(userDirectory.findFriends(ALICE)).thenReturn(List.of());
        when(userDirectory.findByIds(anyCollection())).thenReturn(Map.of());

        assertTrue(service.balances(ALICE).isEmpty());
    }

    @Test
    @DisplayName("Counterparties missing from the directory are shown as Unknown")
    void unknownCounterparty() {
        when(ledgerStore.queryEdges(ALICE)).thenReturn(List.of(
            DebtEdge.of(UUID.randomUUID(), ALICE, CAROL, money("12.50"))));
        when(userDirectory.findFriends(ALICE)).thenReturn(List.of());
        when(userDirectory.findByIds(List.of(CAROL))).thenReturn(Map.of());

        List<FriendBalance> balances = service.balances(ALICE);

        assertEquals(1, balances.size());
        assertEquals("Unknown", balances.get(0).getFriendName());
        assertEquals(money("-12.50"), balances.get(0).getBalance());
    }

    @Test
    @DisplayName("A settlement brings the pair balance back to zero")
    void settlementClearsBalance() {
        UUID dinner = UUID.randomUUID();
        UUID payback = UUID.randomUUID();
        when(ledgerStore.queryEdges(BOB)).thenReturn(List.of(
            DebtEdge.of(dinner, BOB, ALICE, money("50.00")),
            DebtEdge.of(payback, ALICE, BOB, money("50.00"))));

        assertEquals(0, BigDecimal.ZERO.compareTo(service.balance(BOB, ALICE)));
    }

    @Test
    @DisplayName("The breakdown lists each transaction's contribution, newest first")
    void breakdownNewestFirst() {
        printTestHeader("Balance breakdown");
        Transaction dinner = transaction(ALICE, sharedDraft("100.00",
                List.of(payer(ALICE, "100.00")),
                List.of(share(ALICE, "50.00"), share(BOB, "50.00")))
            .toBuilder().date(on("2025-03-01")).build());
        Transaction payback = transaction(BOB, paidSettlementDraft(BOB, ALICE, "alice@example.com", "20.00")
            .toBuilder().date(on("2025-03-10")).build());
        when(ledgerStore.queryEdges(ALICE)).thenReturn(List.of(
            DebtEdge.of(dinner.getId(), BOB, ALICE, money("50.00")),
            DebtEdge.of(payback.getId(), ALICE, BOB, money("20.00")),
            DebtEdge.of(UUID.randomUUID(), CAROL, ALICE, money("5.00"))));
        when(ledgerStore.findTransaction(dinner.getId())).thenReturn(Optional.of(dinner));
        when(ledgerStore.findTransaction(payback.getId())).thenReturn(Optional.of(payback));

        List<BalanceBreakdownEntry> entries = service.breakdown(ALICE, BOB);

        assertEquals(2, entries.size());
        assertEquals(payback.getId(), entries.get(0).getTransactionId());
        assertTrue(entries.get(0).isSettlement());
        assertEquals(money("-20.00"), entries.get(0).getAmount());
        assertEquals(dinner.getId(), entries.get(1).getTransactionId());
        assertFalse(entries.get(1).isSettlement());
        assertEquals(money("50.00"), entries.get(1).getAmount());
        printSuccess("Breakdown sums to the 30.00 Bob still owes");
    }
}
