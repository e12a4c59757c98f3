package com.flagship.expense_ledger.identity;

import com.flagship.expense_ledger.outbox.OutboxService;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Turns profile edits into {@code ProfileChanged} events.
 *
 * Profiles are owned by the identity provider and written straight to user_profiles, so
 * the table is polled for rows whose updated_at moved past the last one seen. Events go
 * through the outbox like every other ledger change. Each instance keeps its own
 * watermark, starting at boot; with several instances a change is announced once per
 * instance, which costs the sessions one extra refresh.
 */
@Component
@ConditionalOnProperty(name = "identity.profile-watch.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ProfileChangeWatcher {

    private static final String CHANGED_SINCE_SQL =
        "SELECT id, updated_at FROM user_profiles WHERE updated_at > :since " +
        "ORDER BY updated_at LIMIT :limit";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    private volatile Instant watermark;

    public ProfileChangeWatcher(NamedParameterJdbcTemplate jdbcTemplate,
                                OutboxService outboxService,
                                TransactionTemplate transactionTemplate,
                                Clock clock,
                                @Value("${identity.profile-watch.batch-size:100}") int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
        this.transactionTemplate = transactionTemplate;
        this.batchSize = batchSize;
        this.watermark = clock.instant();
    }

    @Scheduled(fixedDelayString = "${identity.profile-watch.poll-interval-ms:5000}")
    public void pollProfiles() {
        try {
            emitPendingChanges();
        } catch (Exception e) {
            log.error("Profile change polling failed", e);
        }
    }

    /**
     * Writes one event per profile changed since the last call.
     *
     * @return the number of events written
     */
    public int emitPendingChanges() {
        List<ChangedProfile> changed = jdbcTemplate.query(CHANGED_SINCE_SQL,
            new MapSqlParameterSource()
                .addValue("since", Timestamp.from(watermark))
                .addValue("limit", batchSize),
            (rs, rowNum) -> new ChangedProfile(
                rs.getObject("id", UUID.class),
                rs.getTimestamp("updated_at").toInstant()));
        if (changed.isEmpty()) {
            return 0;
        }

        transactionTemplate.executeWithoutResult(status -> changed.forEach(profile ->
            outboxService.saveEvent(LedgerChangeEvent.profileChanged(profile.id(), profile.updatedAt()))));
        watermark = changed.get(changed.size() - 1).updatedAt();

        log.info("Announced {} profile changes, watermark now {}", changed.size(), watermark);
        return changed.size();
    }

    Instant getWatermark() {
        return watermark;
    }

    private record ChangedProfile(UUID id, Instant updatedAt) {
    }
}
