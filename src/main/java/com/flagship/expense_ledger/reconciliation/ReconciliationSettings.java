package com.flagship.expense_ledger.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ReconciliationSettings {

    /** Quiet period after the last notification before a refresh runs. */
    @Builder.Default
    Duration debounceWindow = Duration.ofMillis(500);

    @Builder.Default
    Duration baseRetryDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxRetryDelay = Duration.ofSeconds(30);

    @Builder.Default
    int maxRetryAttempts = 5;

    /** A session whose last sync is older than this reports stale. */
    @Builder.Default
    Duration staleAfter = Duration.ofSeconds(60);

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(baseRetryDelay, maxRetryDelay, maxRetryAttempts);
    }

    public static ReconciliationSettings defaults() {
        return ReconciliationSettings.builder().build();
    }
}
