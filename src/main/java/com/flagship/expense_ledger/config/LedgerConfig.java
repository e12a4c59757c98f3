package com.flagship.expense_ledger.config;

import com.flagship.expense_ledger.reconciliation.ReconciliationSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class LedgerConfig {

    /**
     * UTC clock. Decides the current month for the carry-forward and the timestamps of
     * activity log entries.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs debounce windows, refreshes and resubscribe timers of the reconciliation sessions.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService reconciliationScheduler(
            @Value("${ledger.reconciliation.scheduler-threads:2}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "reconciliation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(threads, threadFactory);
    }

    @Bean
    public ReconciliationSettings reconciliationSettings(
            @Value("${ledger.reconciliation.debounce-ms:500}") long debounceMs,
            @Value("${ledger.reconciliation.retry.base-delay-ms:1000}") long baseDelayMs,
            @Value("${ledger.reconciliation.retry.max-delay-ms:30000}") long maxDelayMs,
            @Value("${ledger.reconciliation.retry.max-attempts:5}") int maxAttempts,
            @Value("${ledger.reconciliation.stale-after-ms:60000}") long staleAfterMs) {
        return ReconciliationSettings.builder()
                .debounceWindow(Duration.ofMillis(debounceMs))
                .baseRetryDelay(Duration.ofMillis(baseDelayMs))
                .maxRetryDelay(Duration.ofMillis(maxDelayMs))
                .maxRetryAttempts(maxAttempts)
                .staleAfter(Duration.ofMillis(staleAfterMs))
                .build();
    }
}
