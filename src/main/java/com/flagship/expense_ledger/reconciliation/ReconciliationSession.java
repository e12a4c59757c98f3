package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.ledger.FriendBalance;
import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.event.ChangeTable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Keeps one user's {@link LocalLedgerView} eventually consistent with the ledger.
 *
 * Changes to transactions or profiles lead to a transactions refresh; changes to debts
 * lead to a friend balances refresh. Notifications are coalesced per kind. A refresh
 * requested while one of the same kind runs is folded into it: the running refresh may
 * have read the ledger before the change committed, so it fetches once more before it
 * finishes.
 */
@Slf4j
public class ReconciliationSession implements AutoCloseable {

    public enum RefreshKind {
        TRANSACTIONS("transactions"),
        FRIEND_BALANCES("friend_balances");

        private final String tag;

        RefreshKind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    private final UUID userId;
    private final ChangeFeed feed;
    private final LedgerSnapshotSource source;
    private final ReconciliationListener listener;
    private final ReconciliationSettings settings;
    private final ScheduledExecutorService scheduler;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Consumer<ReconciliationSession> onClose;

    private final LocalLedgerView view = new LocalLedgerView();
    private final Map<RefreshKind, AtomicBoolean> running = new EnumMap<>(RefreshKind.class);
    private final Map<RefreshKind, AtomicBoolean> rerunRequested = new EnumMap<>(RefreshKind.class);
    private final Map<RefreshKind, ChangeCoalescer> coalescers = new EnumMap<>(RefreshKind.class);
    private final List<ResilientSubscription> subscriptions = new ArrayList<>();

    private volatile Instant lastSyncedAt;
    private volatile boolean degraded;
    private volatile boolean closed;

    public ReconciliationSession(UUID userId, ChangeFeed feed, LedgerSnapshotSource source,
                                 ReconciliationListener listener, ReconciliationSettings settings,
                                 ScheduledExecutorService scheduler, LedgerMetrics metrics, Clock clock,
                                 Consumer<ReconciliationSession> onClose) {
        this.userId = userId;
        this.feed = feed;
        this.source = source;
        this.listener = listener;
        this.settings = settings;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.onClose = onClose;

        for (RefreshKind kind : RefreshKind.values()) {
            running.put(kind, new AtomicBoolean());
            rerunRequested.put(kind, new AtomicBoolean());
            coalescers.put(kind, new ChangeCoalescer(scheduler, settings.getDebounceWindow(), () -> refresh(kind)));
        }
    }

    /**
     * Subscribes to the three tables and schedules an initial refresh of both kinds.
     */
    public void start() {
        RetryPolicy retryPolicy = settings.retryPolicy();
        subscribe(ChangeTable.TRANSACTIONS, RefreshKind.TRANSACTIONS, retryPolicy);
        subscribe(ChangeTable.DEBTS, RefreshKind.FRIEND_BALANCES, retryPolicy);
        subscribe(ChangeTable.USER_PROFILES, RefreshKind.TRANSACTIONS, retryPolicy);

        requestRefresh(RefreshKind.TRANSACTIONS);
        requestRefresh(RefreshKind.FRIEND_BALANCES);
        log.info("Reconciliation session started for user {}", userId);
    }

    /**
     * Schedules a refresh without waiting for a notification.
     */
    public void requestRefresh(RefreshKind kind) {
        if (closed) {
            return;
        }
        try {
            scheduler.execute(() -> refresh(kind));
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule {} refresh for user {}: scheduler is shut down", kind.tag(), userId);
        }
    }

    /**
     * Runs a refresh on the calling thread.
     *
     * @return false if the session is closed, the refresh failed, or the request was
     *         folded into a refresh of the same kind that is already running
     */
    public boolean refresh(RefreshKind kind) {
        if (closed) {
            return false;
        }
        AtomicBoolean flag = running.get(kind);
        AtomicBoolean rerun = rerunRequested.get(kind);
        rerun.set(true);
        if (!flag.compareAndSet(false, true)) {
            log.debug("{} refresh for user {} already running, it will fetch again", kind.tag(), userId);
            metrics.recordRefresh(kind.tag(), "collapsed");
            return false;
        }
        boolean succeeded = false;
        try {
            while (rerun.getAndSet(false) && !closed) {
                succeeded = refreshOnce(kind);
            }
        } finally {
            flag.set(false);
        }
        // a request that arrived between the last fetch and releasing the flag
        if (rerun.get() && !closed) {
            requestRefresh(kind);
        }
        return succeeded;
    }

    private boolean refreshOnce(RefreshKind kind) {
        try {
            if (kind == RefreshKind.TRANSACTIONS) {
                refreshTransactions();
            } else {
                refreshFriendBalances();
            }
            metrics.recordRefresh(kind.tag(), "success");
            return true;
        } catch (RuntimeException e) {
            log.warn("{} refresh for user {} failed: {}", kind.tag(), userId, e.getMessage(), e);
            metrics.recordRefresh(kind.tag(), "failure");
            listener.onRefreshFailed(kind, e);
            return false;
        }
    }

    private void refreshTransactions() {
        TransactionsSnapshot snapshot = source.fetchTransactions(userId);
        if (closed) {
            return;
        }
        view.replaceTransactions(snapshot);
        lastSyncedAt = clock.instant();
        listener.onTransactionsRefreshed(view);
    }

    private void refreshFriendBalances() {
        List<FriendBalance> balances = source.fetchFriendBalances(userId);
        if (closed) {
            return;
        }
        view.replaceFriendBalances(balances);
        lastSyncedAt = clock.instant();
        listener.onFriendBalancesRefreshed(balances);
    }

    public void applyLocalCreate(Transaction transaction) {
        if (closed) {
            return;
        }
        view.applyLocalCreate(transaction);
        listener.onLocalChange(view);
    }

    public void applyLocalUpdate(Transaction transaction) {
        if (closed) {
            return;
        }
        view.applyLocalUpdate(transaction);
        listener.onLocalChange(view);
    }

    public boolean applyLocalDelete(UUID transactionId) {
        if (closed || !view.applyLocalDelete(transactionId, clock.instant())) {
            return false;
        }
        listener.onLocalChange(view);
        return true;
    }

    public LocalLedgerView getView() {
        return view;
    }

    public UUID getUserId() {
        return userId;
    }

    public Instant getLastSyncedAt() {
        return lastSyncedAt;
    }

    /**
     * True until the first successful refresh, and whenever the last one is older than
     * the configured threshold.
     */
    public boolean isStale() {
        Instant synced = lastSyncedAt;
        return synced == null
            || Duration.between(synced, clock.instant()).compareTo(settings.getStaleAfter()) > 0;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isClosed() {
        return closed;
    }

    public Map<ChangeTable, SubscriptionState> subscriptionStates() {
        Map<ChangeTable, SubscriptionState> states = new EnumMap<>(ChangeTable.class);
        synchronized (subscriptions) {
            subscriptions.forEach(s -> states.put(s.getTable(), s.getState()));
        }
        return states;
    }

    /**
     * Cancels pending refreshes and retry timers and releases the subscriptions.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        coalescers.values().forEach(ChangeCoalescer::close);
        synchronized (subscriptions) {
            subscriptions.forEach(ResilientSubscription::close);
        }
        onClose.accept(this);
        log.info("Reconciliation session closed for user {}", userId);
    }

    private void subscribe(ChangeTable table, RefreshKind kind, RetryPolicy retryPolicy) {
        ChangeCoalescer coalescer = coalescers.get(kind);
        ResilientSubscription subscription = new ResilientSubscription(
            feed, userId, table,
            event -> coalescer.signal(),
            this::markDegraded,
            retryPolicy, scheduler, metrics);
        synchronized (subscriptions) {
            subscriptions.add(subscription);
        }
        subscription.open();
    }

    private void markDegraded(ReconciliationException cause) {
        if (closed) {
            return;
        }
        degraded = true;
        log.warn("Reconciliation session of user {} degraded, data may be stale: {}", userId, cause.getMessage());
        listener.onDegraded(cause);
    }
}
