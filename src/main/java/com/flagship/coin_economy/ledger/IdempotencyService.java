package com.flagship.coin_economy.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookups for ledger commits.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the committed row in ledger_transactions (source of truth)
 * 3. Cache a key in Redis only after the transaction that owns it has committed
 *
 * Redis never decides anything on its own: a stale or missing entry only costs
 * a database round trip, because the partial unique index on committed keys is
 * what actually prevents double application.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Finds the committed transaction that owns a key.
     *
     * @return transaction id if the key has been committed, empty otherwise
     */
    public Optional<UUID> findCommittedTransaction(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> committed = ledgerStore.findCommittedByKey(idempotencyKey)
            .map(LedgerTransaction::getId);
        committed.ifPresent(transactionId -> cache(idempotencyKey, transactionId));
        return committed;
    }

    /**
     * Caches the key once the surrounding transaction commits. A rolled back
     * commit leaves nothing behind in Redis.
     */
    public void rememberAfterCommit(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, transactionId);
                }
            });
        } else {
            cache(idempotencyKey, transactionId);
        }
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
            log.debug("Stored idempotency key in Redis: {} -> {}", idempotencyKey, transactionId);
        } catch (Exception e) {
            // database remains the source of truth
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
