package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.ledger.FriendBalance;
import com.flagship.expense_ledger.transaction.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams a user's reconciled ledger view as server-sent events.
 *
 * Events: {@code transactions} (live transactions, profiles, monthly balances, and the
 * count of the user's own writes not yet confirmed by a snapshot),
 * {@code friend_balances}, and {@code degraded} once live updates stopped. The session
 * lives as long as the stream.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
public class LedgerSyncController {

    private final ReconciliationSessionFactory sessionFactory;

    @Value("${ledger.sync.stream-timeout-ms:1800000}")
    private long streamTimeoutMs;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader("X-User-Id") UUID userId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        AtomicReference<ReconciliationSession> sessionRef = new AtomicReference<>();

        ReconciliationListener listener = new ReconciliationListener() {
            @Override
            public void onTransactionsRefreshed(LocalLedgerView view) {
                send("transactions", transactionsPayload(view));
            }

            @Override
            public void onLocalChange(LocalLedgerView view) {
                send("transactions", transactionsPayload(view));
            }

            @Override
            public void onFriendBalancesRefreshed(List<FriendBalance> balances) {
                send("friend_balances", balances);
            }

            @Override
            public void onDegraded(ReconciliationException cause) {
                send("degraded", Map.of("message", "Live updates stopped, data may be stale"));
            }

            private void send(String name, Object data) {
                try {
                    emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
                } catch (IOException | IllegalStateException e) {
                    log.debug("Sync stream of user {} is gone: {}", userId, e.getMessage());
                    closeSession(sessionRef);
                }
            }
        };

        emitter.onCompletion(() -> closeSession(sessionRef));
        emitter.onTimeout(() -> closeSession(sessionRef));
        emitter.onError(e -> closeSession(sessionRef));

        sessionRef.set(sessionFactory.open(userId, listener));
        return emitter;
    }

    static Map<String, Object> transactionsPayload(LocalLedgerView view) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transactions", view.getTransactions().stream().map(TransactionResponse::from).toList());
        payload.put("profiles", view.getProfiles().values());
        payload.put("monthly_balances", view.getMonthlyBalances());
        payload.put("unconfirmed_changes", view.getUnconfirmedChanges());
        return payload;
    }

    private static void closeSession(AtomicReference<ReconciliationSession> sessionRef) {
        ReconciliationSession session = sessionRef.get();
        if (session != null) {
            session.close();
        }
    }
}
