package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps idempotency keys of create requests to the transactions they created.
 *
 * Redis is a cache in front of the unique idempotency_key column: a Redis outage slows
 * lookups down but never lets a key create a second transaction.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * The transaction previously created with this key, if any.
     */
    public Optional<Transaction> findExisting(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cachedId = readCache(idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<Transaction> cached = ledgerStore.findTransaction(cachedId.get());
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
        }

        Optional<Transaction> stored = ledgerStore.findTransactionByIdempotencyKey(idempotencyKey);
        stored.ifPresent(tx -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            remember(idempotencyKey, tx.getId());
        });
        return stored;
    }

    /**
     * Caches the key in Redis. The database row written with the transaction stays the
     * source of truth, so a failure here is logged and ignored.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return value != null ? Optional.of(UUID.fromString(value)) : Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
