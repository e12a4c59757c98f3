package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InProcessChangeFeedTest {

    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final Instant NOW = Instant.parse("2025-03-15T10:00:00Z");

    private final InProcessChangeFeed feed = new InProcessChangeFeed();

    @Test
    @DisplayName("Transaction changes reach only the affected users")
    void filtersByAffectedUser() {
        RecordingListener alice = new RecordingListener();
        RecordingListener bob = new RecordingListener();
        feed.subscribe(ALICE, ChangeTable.TRANSACTIONS, alice);
        feed.subscribe(BOB, ChangeTable.TRANSACTIONS, bob);

        int delivered = feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.INSERT, Set.of(ALICE), NOW));

        assertEquals(1, delivered);
        assertEquals(1, alice.events.size());
        assertTrue(bob.events.isEmpty());
    }

    @Test
    @DisplayName("Events are delivered only to subscribers of their table")
    void filtersByTable() {
        RecordingListener debts = new RecordingListener();
        feed.subscribe(ALICE, ChangeTable.DEBTS, debts);

        feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.UPDATE, Set.of(ALICE), NOW));
        feed.publish(LedgerChangeEvent.debtsChanged(UUID.randomUUID(), Set.of(ALICE), NOW));

        assertEquals(1, debts.events.size());
        assertEquals(ChangeTable.DEBTS, debts.events.get(0).table());
    }

    @Test
    @DisplayName("Profile changes reach every profile subscriber")
    void profileChangesBroadcast() {
        RecordingListener alice = new RecordingListener();
        RecordingListener bob = new RecordingListener();
        feed.subscribe(ALICE, ChangeTable.USER_PROFILES, alice);
        feed.subscribe(BOB, ChangeTable.USER_PROFILES, bob);

        assertEquals(2, feed.publish(LedgerChangeEvent.profileChanged(ALICE, NOW)));
    }

    @Test
    @DisplayName("A closed subscription receives nothing")
    void closedSubscription() {
        RecordingListener alice = new RecordingListener();
        ChangeSubscription subscription = feed.subscribe(ALICE, ChangeTable.TRANSACTIONS, alice);

        subscription.close();
        feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.DELETE, Set.of(ALICE), NOW));

        assertFalse(subscription.isActive());
        assertTrue(alice.events.isEmpty());
        assertEquals(0, feed.subscriptionCount());
    }

    @Test
    @DisplayName("A throwing listener does not block delivery to others")
    void throwingListenerIsolated() {
        RecordingListener bob = new RecordingListener();
        feed.subscribe(ALICE, ChangeTable.USER_PROFILES, new ChangeListener() {
            @Override
            public void onChange(LedgerChangeEvent event) {
                throw new IllegalStateException("listener broke");
            }

            @Override
            public void onSubscriptionError(Throwable cause) {
            }
        });
        feed.subscribe(BOB, ChangeTable.USER_PROFILES, bob);

        int delivered = feed.publish(LedgerChangeEvent.profileChanged(BOB, NOW));

        assertEquals(1, delivered);
        assertEquals(1, bob.events.size());
    }

    @Test
    @DisplayName("Interrupting drops subscriptions and refuses new ones until resumed")
    void interruptAndResume() {
        RecordingListener alice = new RecordingListener();
        ChangeSubscription subscription = feed.subscribe(ALICE, ChangeTable.TRANSACTIONS, alice);

        feed.interrupt(new ReconciliationException("consumer stopped"));

        assertFalse(feed.isAvailable());
        assertFalse(subscription.isActive());
        assertEquals(1, alice.errors.size());
        assertThrows(ReconciliationException.class,
            () -> feed.subscribe(ALICE, ChangeTable.TRANSACTIONS, alice));

        feed.resume();

        assertTrue(feed.isAvailable());
        assertTrue(feed.subscribe(ALICE, ChangeTable.TRANSACTIONS, alice).isActive());
    }

    static class RecordingListener implements ChangeListener {
        final List<LedgerChangeEvent> events = new ArrayList<>();
        final List<Throwable> errors = new ArrayList<>();

        @Override
        public void onChange(LedgerChangeEvent event) {
            events.add(event);
        }

        @Override
        public void onSubscriptionError(Throwable cause) {
            errors.add(cause);
        }
    }
}
