package com.flagship.expense_ledger.reconciliation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns a burst of signals into one run of an action.
 *
 * Every signal restarts the window; the action runs once the window passes without a
 * new signal. A write touching many debt rows thus causes a single refresh.
 */
@Slf4j
public class ChangeCoalescer implements AutoCloseable {

    private final ScheduledExecutorService scheduler;
    private final Duration window;
    private final Runnable action;

    private ScheduledFuture<?> pending;
    private long generation;
    private boolean closed;

    public ChangeCoalescer(ScheduledExecutorService scheduler, Duration window, Runnable action) {
        this.scheduler = scheduler;
        this.window = window;
        this.action = action;
    }

    public synchronized void signal() {
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        long scheduled = ++generation;
        pending = scheduler.schedule(() -> fire(scheduled), window.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    /**
     * Cancels a pending run. Later signals are ignored.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire(long scheduled) {
        synchronized (this) {
            // superseded by a later signal
            if (closed || scheduled != generation) {
                return;
            }
            pending = null;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Coalesced action failed: {}", e.getMessage(), e);
        }
    }
}
