package com.flagship.mpesa_bridge.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for payment initiation.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the transactions table (slower, always available)
 * 3. Back-fill Redis after a database hit
 *
 * The unique constraint on transactions.idempotency_key is the real guard.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "mpesa:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(1);

    private final TransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the transaction already created for an idempotency key.
     *
     * @return transaction id if the key was used before, empty otherwise
     */
    public Optional<UUID> findTransactionId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        String redisKey = REDIS_KEY_PREFIX + idempotencyKey;

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(TransactionEntity::getId);

        stored.ifPresent(transactionId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, transactionId);
        });

        return stored;
    }

    /**
     * Caches a key after the transaction row has been written. Best effort.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        cache(REDIS_KEY_PREFIX + idempotencyKey, transactionId);
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }
}
