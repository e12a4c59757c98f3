package com.flagship.expense_ledger.observability;

import com.flagship.expense_ledger.outbox.OutboxEventRepository;
import com.flagship.expense_ledger.reconciliation.InProcessChangeFeed;
import com.flagship.expense_ledger.reconciliation.ReconciliationSessionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the expense ledger, grouped as in the actuator output.
 */
public class HealthIndicators {

    /**
     * Outbox backlog. Sessions see changes late while events wait here.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency fast path only; without it keys are looked up in the database.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency keys fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Change feed availability and sessions that stopped receiving updates.
     */
    @Component("reconciliationHealth")
    public static class ReconciliationHealthIndicator implements HealthIndicator {

        private final InProcessChangeFeed changeFeed;
        private final ReconciliationSessionFactory sessionFactory;

        public ReconciliationHealthIndicator(InProcessChangeFeed changeFeed,
                                             ReconciliationSessionFactory sessionFactory) {
            this.changeFeed = changeFeed;
            this.sessionFactory = sessionFactory;
        }

        @Override
        public Health health() {
            long degraded = sessionFactory.degradedSessionCount();
            Health.Builder builder = !changeFeed.isAvailable()
                    ? Health.down()
                    : degraded > 0 ? Health.status("DEGRADED") : Health.up();
            return builder
                    .withDetail("changeFeedAvailable", changeFeed.isAvailable())
                    .withDetail("subscriptions", changeFeed.subscriptionCount())
                    .withDetail("openSessions", sessionFactory.openSessionCount())
                    .withDetail("degradedSessions", degraded)
                    .build();
        }
    }
}
