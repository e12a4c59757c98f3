package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ResilientSubscriptionTest {

    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final Instant NOW = Instant.parse("2025-03-15T10:00:00Z");
    private static final RetryPolicy FAST_RETRIES =
        new RetryPolicy(Duration.ofMillis(10), Duration.ofMillis(40), 3);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LedgerMetrics metrics = new LedgerMetrics(registry);
    private final List<LedgerChangeEvent> received = new CopyOnWriteArrayList<>();
    private final List<ReconciliationException> degraded = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("Subscribes immediately when the feed is available")
    void subscribesImmediately() {
        InProcessChangeFeed feed = new InProcessChangeFeed();
        ResilientSubscription subscription = subscription(feed, FAST_RETRIES);

        subscription.open();

        assertEquals(SubscriptionState.subscribed(), subscription.getState());
        feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.INSERT, Set.of(ALICE), NOW));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Recovers after transient failures and resets the attempt counter")
    void recoversAfterTransientFailures() throws InterruptedException {
        FlakyFeed feed = new FlakyFeed(2);
        ResilientSubscription subscription = subscription(feed, FAST_RETRIES);

        subscription.open();
        assertEquals(SubscriptionState.retrying(1), subscription.getState());

        awaitTrue(() -> subscription.getState().getStatus() == SubscriptionState.Status.SUBSCRIBED);

        assertEquals(3, feed.attempts.get());
        assertEquals(0, subscription.getState().getAttempt());
        assertTrue(degraded.isEmpty());
        assertEquals(2.0, registry.counter("reconciliation.resubscribes").count());
    }

    @Test
    @DisplayName("Gives up after the last retry and reports degradation once")
    void givesUpAfterMaxAttempts() throws InterruptedException {
        FlakyFeed feed = new FlakyFeed(Integer.MAX_VALUE);
        ResilientSubscription subscription = subscription(feed, FAST_RETRIES);

        subscription.open();
        awaitTrue(() -> subscription.getState().getStatus() == SubscriptionState.Status.FAILED);
        Thread.sleep(100);

        assertEquals(SubscriptionState.failed(3), subscription.getState());
        assertEquals(4, feed.attempts.get());
        assertEquals(1, degraded.size());
        assertEquals(1.0, registry.counter("reconciliation.degraded").count());
    }

    @Test
    @DisplayName("Resubscribes after the feed drops the subscription")
    void resubscribesAfterDrop() throws InterruptedException {
        InProcessChangeFeed feed = new InProcessChangeFeed();
        ResilientSubscription subscription = subscription(feed,
            new RetryPolicy(Duration.ofMillis(50), Duration.ofMillis(50), 5));
        subscription.open();

        feed.interrupt(new ReconciliationException("consumer stopped"));
        assertEquals(SubscriptionState.Status.RETRYING, subscription.getState().getStatus());

        feed.resume();
        awaitTrue(() -> subscription.getState().getStatus() == SubscriptionState.Status.SUBSCRIBED);

        assertEquals(1, feed.subscriptionCount());
        feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.UPDATE, Set.of(ALICE), NOW));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Closing while retrying cancels the pending retry")
    void closeCancelsRetry() throws InterruptedException {
        FlakyFeed feed = new FlakyFeed(Integer.MAX_VALUE);
        ResilientSubscription subscription = subscription(feed,
            new RetryPolicy(Duration.ofMillis(50), Duration.ofMillis(50), 5));

        subscription.open();
        subscription.close();
        Thread.sleep(200);

        assertEquals(SubscriptionState.closed(), subscription.getState());
        assertEquals(1, feed.attempts.get());
        assertTrue(degraded.isEmpty());
    }

    @Test
    @DisplayName("Closing a live subscription releases it from the feed")
    void closeReleasesFeedSubscription() {
        InProcessChangeFeed feed = new InProcessChangeFeed();
        ResilientSubscription subscription = subscription(feed, FAST_RETRIES);
        subscription.open();

        subscription.close();

        assertEquals(0, feed.subscriptionCount());
        feed.publish(LedgerChangeEvent.transactionChanged(
            UUID.randomUUID(), LedgerChangeEvent.ChangeType.INSERT, Set.of(ALICE), NOW));
        assertTrue(received.isEmpty());
    }

    private ResilientSubscription subscription(ChangeFeed feed, RetryPolicy policy) {
        return new ResilientSubscription(feed, ALICE, ChangeTable.TRANSACTIONS, received::add, degraded::add, policy, scheduler, metrics);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not reached within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    /**
     * Refuses the first {@code failures} subscribe calls.
     */
    static class FlakyFeed implements ChangeFeed {
        final AtomicInteger attempts = new AtomicInteger();
        private final int failures;

        FlakyFeed(int failures) {
            this.failures = failures;
        }

        @Override
        public ChangeSubscription subscribe(UUID userId, ChangeTable table, ChangeListener listener) {
            if (attempts.incrementAndGet() <= failures) {
                throw new ReconciliationException("feed unavailable");
            }
            return new ChangeSubscription() {
                private volatile boolean active = true;

                @Override
                public boolean isActive() {
                    return active;
                }

                @Override
                public void close() {
                    active = false;
                }
            };
        }
    }
}
