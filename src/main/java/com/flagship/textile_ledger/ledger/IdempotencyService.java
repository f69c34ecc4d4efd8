package com.flagship.textile_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps payment idempotency keys to the entry they were recorded against.
 *
 * Redis is a fast path only. The source of truth is the unique
 * {@code ledger_payments.idempotency_key} column, so a Redis outage costs a
 * database lookup and nothing else.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger-payment:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerRecordStore store;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LedgerRecordStore store,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.store = store;
        this.redisTemplate = redisTemplate;
    }

    public Optional<EntryId> findEntryForKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(EntryId.parse(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<EntryId> stored = store.findEntryByIdempotencyKey(idempotencyKey);
        stored.ifPresent(entryId -> cache(idempotencyKey, entryId));
        return stored;
    }

    /**
     * Caches a freshly used key. The database row written with the payment is
     * what actually makes the key used.
     */
    public void remember(String idempotencyKey, EntryId entryId) {
        requireKey(idempotencyKey);
        cache(idempotencyKey, entryId);
    }

    private void cache(String idempotencyKey, EntryId entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
