package com.flagship.expense_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges on a fixed schedule instead of on every scrape.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}
