package com.flagship.expense_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the ledger write path and the reconciliation sessions.
 *
 * Metrics exposed:
 * - ledger.transactions.written: writes by operation (create/update/delete) and outcome
 * - ledger.write.duration: latency of the write pipeline by operation
 * - ledger.validation.rejected: drafts rejected by validation
 * - ledger.netting.edges: edges produced per recompute
 * - idempotency.cache: idempotency key lookups, hit or miss
 * - reconciliation.refreshes / reconciliation.degraded / reconciliation.resubscribes
 * - consumer.events: change events consumed by result
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter validationRejected;
    private final Counter degradedSessions;
    private final DistributionSummary edgesPerRecompute;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.validationRejected = Counter.builder("ledger.validation.rejected")
                .description("Transaction drafts rejected by validation")
                .register(registry);

        this.degradedSessions = Counter.builder("reconciliation.degraded")
                .description("Sessions that gave up resubscribing and may show stale data")
                .register(registry);

        this.edgesPerRecompute = DistributionSummary.builder("ledger.netting.edges")
                .description("Debt edges produced by one netting recompute")
                .register(registry);
    }

    public void recordWrite(String operation, String outcome, Duration duration) {
        registry.counter("ledger.transactions.written",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer.builder("ledger.write.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordValidationRejected() {
        validationRejected.increment();
    }

    public void recordEdges(int edgeCount) {
        edgesPerRecompute.record(edgeCount);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordRefresh(String kind, String outcome) {
        registry.counter("reconciliation.refreshes",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordResubscribeAttempt() {
        registry.counter("reconciliation.resubscribes").increment();
    }

    public void recordDegraded() {
        degradedSessions.increment();
    }

    public void recordEventConsumed(String eventType, String result) {
        registry.counter("consumer.events",
                "event_type", sanitizeTag(eventType),
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
