package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A change feed subscription that resubscribes with backoff when it fails.
 *
 * <pre>
 * CONNECTING -> SUBSCRIBED -> (error) -> RETRYING(1) -> ... -> RETRYING(max) -> FAILED
 *                   ^                        |
 *                   +---- resubscribed ------+
 * </pre>
 * A successful resubscribe resets the attempt counter. Reaching FAILED hands a
 * {@link ReconciliationException} to the degraded handler once; {@link #close()} moves to
 * CLOSED from any state and cancels a pending retry.
 */
@Slf4j
public class ResilientSubscription implements AutoCloseable {

    private final ChangeFeed feed;
    private final UUID userId;
    private final ChangeTable table;
    private final Consumer<LedgerChangeEvent> onChange;
    private final Consumer<ReconciliationException> onDegraded;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final LedgerMetrics metrics;

    private SubscriptionState state = SubscriptionState.connecting();
    private ChangeSubscription current;
    private long generation;
    private int attempt;
    private ScheduledFuture<?> retryTimer;

    public ResilientSubscription(ChangeFeed feed, UUID userId, ChangeTable table,
                                 Consumer<LedgerChangeEvent> onChange,
                                 Consumer<ReconciliationException> onDegraded,
                                 RetryPolicy retryPolicy, ScheduledExecutorService scheduler,
                                 LedgerMetrics metrics) {
        this.feed = feed;
        this.userId = userId;
        this.table = table;
        this.onChange = onChange;
        this.onDegraded = onDegraded;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    public void open() {
        connect();
    }

    public synchronized SubscriptionState getState() {
        return state;
    }

    public ChangeTable getTable() {
        return table;
    }

    @Override
    public void close() {
        ChangeSubscription toClose;
        synchronized (this) {
            if (state.getStatus() == SubscriptionState.Status.CLOSED) {
                return;
            }
            state = SubscriptionState.closed();
            generation++;
            cancelRetryTimer();
            toClose = current;
            current = null;
        }
        if (toClose != null) {
            toClose.close();
        }
        log.debug("Closed {} subscription of user {}", table.tableName(), userId);
    }

    private void connect() {
        long connectGeneration;
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            retryTimer = null;
            connectGeneration = ++generation;
        }

        ChangeSubscription subscription;
        try {
            subscription = feed.subscribe(userId, table, new Binding(connectGeneration));
        } catch (RuntimeException e) {
            fail(connectGeneration, e);
            return;
        }

        boolean stale;
        synchronized (this) {
            stale = connectGeneration != generation || state.isTerminal();
            if (!stale) {
                if (attempt > 0) {
                    log.info("Resubscribed user {} to {} changes after {} retries",
                            userId, table.tableName(), attempt);
                }
                current = subscription;
                attempt = 0;
                state = SubscriptionState.subscribed();
            }
        }
        if (stale) {
            subscription.close();
        }
    }

    private void fail(long failedGeneration, Throwable cause) {
        ReconciliationException degraded = null;
        synchronized (this) {
            if (failedGeneration != generation || state.isTerminal()) {
                return;
            }
            generation++;
            if (current != null) {
                current.close();
                current = null;
            }

            attempt++;
            if (!retryPolicy.allows(attempt)) {
                int spent = attempt - 1;
                state = SubscriptionState.failed(spent);
                log.warn("Giving up on {} subscription of user {} after {} retries",
                        table.tableName(), userId, spent);
                degraded = new ReconciliationException(
                    "Subscription to " + table.tableName() + " changes failed after " + spent + " retries", cause);
            } else {
                Duration delay = retryPolicy.delayBefore(attempt);
                state = SubscriptionState.retrying(attempt);
                log.info("Retrying {} subscription of user {} in {} ms (attempt {}): {}",
                        table.tableName(), userId, delay.toMillis(), attempt, cause.getMessage());
                metrics.recordResubscribeAttempt();
                retryTimer = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        if (degraded != null) {
            metrics.recordDegraded();
            onDegraded.accept(degraded);
        }
    }

    private void cancelRetryTimer() {
        if (retryTimer != null) {
            retryTimer.cancel(false);
            retryTimer = null;
        }
    }

    /**
     * Listener bound to one connection; callbacks of a replaced connection are ignored.
     */
    private final class Binding implements ChangeListener {
        private final long boundGeneration;

        private Binding(long boundGeneration) {
            this.boundGeneration = boundGeneration;
        }

        @Override
        public void onChange(LedgerChangeEvent event) {
            synchronized (ResilientSubscription.this) {
                if (boundGeneration != generation
                        || state.getStatus() != SubscriptionState.Status.SUBSCRIBED) {
                    return;
                }
            }
            onChange.accept(event);
        }

        @Override
        public void onSubscriptionError(Throwable cause) {
            fail(boundGeneration, cause);
        }
    }
}
