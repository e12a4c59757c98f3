package com.flagship.expense_ledger.reconciliation;

import com.flagship.expense_ledger.transaction.event.ChangeTable;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans change events received by this instance out to the local subscriptions.
 *
 * Events for {@code user_profiles} go to every subscriber of that table; other events go
 * to the subscribers whose user is affected. While the feed is interrupted (the Kafka
 * consumer stopped abnormally) every subscribe attempt fails.
 */
@Component
@Slf4j
public class InProcessChangeFeed implements ChangeFeed {

    private final Map<UUID, Registration> registrations = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public ChangeSubscription subscribe(UUID userId, ChangeTable table, ChangeListener listener) {
        if (!available) {
            throw new ReconciliationException("Change feed is unavailable");
        }
        Registration registration = new Registration(UUID.randomUUID(), userId, table, listener);
        registrations.put(registration.id, registration);
        log.debug("Subscribed user {} to {} changes", userId, table.tableName());
        return registration;
    }

    /**
     * Delivers the event to every matching subscription.
     *
     * @return number of subscriptions notified
     */
    public int publish(LedgerChangeEvent event) {
        int delivered = 0;
        for (Registration registration : registrations.values()) {
            if (!registration.accepts(event)) {
                continue;
            }
            try {
                registration.listener.onChange(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Change listener of user {} failed on event {}: {}",
                        registration.userId, event.eventId(), e.getMessage(), e);
            }
        }
        return delivered;
    }

    /**
     * Drops every subscription with {@code cause} and refuses new ones until {@link #resume()}.
     */
    public void interrupt(Throwable cause) {
        available = false;
        List<Registration> dropped = new ArrayList<>(registrations.values());
        registrations.clear();
        log.warn("Change feed interrupted, dropping {} subscriptions: {}", dropped.size(), cause.getMessage());
        for (Registration registration : dropped) {
            registration.active = false;
            registration.listener.onSubscriptionError(cause);
        }
    }

    public void resume() {
        if (!available) {
            log.info("Change feed available again");
        }
        available = true;
    }

    public boolean isAvailable() {
        return available;
    }

    public int subscriptionCount() {
        return registrations.size();
    }

    private final class Registration implements ChangeSubscription {
        private final UUID id;
        private final UUID userId;
        private final ChangeTable table;
        private final ChangeListener listener;
        private volatile boolean active = true;

        private Registration(UUID id, UUID userId, ChangeTable table, ChangeListener listener) {
            this.id = id;
            this.userId = userId;
            this.table = table;
            this.listener = listener;
        }

        boolean accepts(LedgerChangeEvent event) {
            if (!active || event.table() != table) {
                return false;
            }
            return table == ChangeTable.USER_PROFILES || event.concerns(userId);
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            registrations.remove(id);
        }
    }
}
