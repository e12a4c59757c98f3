package com.flagship.expense_ledger.reconciliation;

import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff: the n-th retry waits {@code min(base * 2^(n-1), max)}.
 */
@Value
public class RetryPolicy {

    Duration baseDelay;
    Duration maxDelay;
    int maxAttempts;

    public RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Retry delays must satisfy 0 <= base <= max");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attempt 1 for the first retry
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1, got " + attempt);
        }
        // 2^30 times any sensible base is already beyond every cap
        int exponent = Math.min(attempt - 1, 30);
        long delayMs = baseDelay.toMillis() * (1L << exponent);
        if (delayMs < 0 || delayMs > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(delayMs);
    }

    public boolean allows(int attempt) {
        return attempt <= maxAttempts;
    }
}
