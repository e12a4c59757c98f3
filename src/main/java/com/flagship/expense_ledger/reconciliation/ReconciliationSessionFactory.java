package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.Transaction;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Opens reconciliation sessions and keeps track of the ones still open.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSessionFactory {

    private final ChangeFeed changeFeed;
    private final LedgerSnapshotSource snapshotSource;
    private final ReconciliationSettings settings;
    private final ScheduledExecutorService reconciliationScheduler;
    private final LedgerMetrics metrics;
    private final Clock clock;

    private final Set<ReconciliationSession> openSessions = ConcurrentHashMap.newKeySet();

    public ReconciliationSession open(UUID userId, ReconciliationListener listener) {
        ReconciliationSession session = new ReconciliationSession(
            userId, changeFeed, snapshotSource, listener, settings,
            reconciliationScheduler, metrics, clock, openSessions::remove);
        openSessions.add(session);
        session.start();
        return session;
    }

    /**
     * Open sessions of one user; a user may stream from several clients at once.
     */
    public List<ReconciliationSession> sessionsOf(UUID userId) {
        return openSessions.stream()
            .filter(session -> session.getUserId().equals(userId))
            .toList();
    }

    /**
     * Shows a write the user just made in each of their sessions before the change
     * notification arrives.
     */
    public void applyLocalWrite(UUID userId, Transaction transaction, boolean created) {
        for (ReconciliationSession session : sessionsOf(userId)) {
            if (created) {
                session.applyLocalCreate(transaction);
            } else {
                session.applyLocalUpdate(transaction);
            }
        }
    }

    public void applyLocalDelete(UUID userId, UUID transactionId) {
        sessionsOf(userId).forEach(session -> session.applyLocalDelete(transactionId));
    }

    public int openSessionCount() {
        return openSessions.size();
    }

    public long degradedSessionCount() {
        return openSessions.stream().filter(ReconciliationSession::isDegraded).count();
    }

    @PreDestroy
    public void closeAll() {
        List<ReconciliationSession> sessions = new ArrayList<>(openSessions);
        if (!sessions.isEmpty()) {
            log.info("Closing {} reconciliation sessions", sessions.size());
        }
        sessions.forEach(ReconciliationSession::close);
    }
}
