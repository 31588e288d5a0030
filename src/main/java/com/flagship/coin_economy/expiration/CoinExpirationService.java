package com.flagship.coin_economy.expiration;

import com.flagship.coin_economy.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Schedules and cancels coin expirations. Called by the flows that grant coins.
 */
@Service
@Slf4j
public class CoinExpirationService {

    private final CoinExpirationRepository repository;
    private final Clock clock;
    private final Duration defaultHorizon;

    public CoinExpirationService(CoinExpirationRepository repository,
                                 Clock clock,
                                 @Value("${economy.expiration.default-days:90}") long defaultDays) {
        this.repository = repository;
        this.clock = clock;
        this.defaultHorizon = Duration.ofDays(defaultDays);
    }

    @Transactional
    public CoinExpiration schedule(String userId, long amount, Instant expiresAt, UUID sourceTransactionId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Expiring amount must be positive: " + amount);
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry date is required");
        }
        CoinExpiration expiration = new CoinExpiration(
            UUID.randomUUID(),
            userId,
            sourceTransactionId,
            amount,
            amount,
            null,
            expiresAt,
            null,
            ExpirationStatus.PENDING,
            null,
            false,
            null,
            Instant.now(clock)
        );
        CoinExpiration saved = repository.save(CoinExpirationEntity.fromDomain(expiration)).toDomain();
        log.info("Scheduled coin expiration: id={}, userId={}, amount={}, expiresAt={}",
                saved.getId(), userId, amount, expiresAt);
        return saved;
    }

    /**
     * Schedules an expiration at the default retention horizon from now.
     */
    @Transactional
    public CoinExpiration scheduleDefault(String userId, long amount, UUID sourceTransactionId) {
        return schedule(userId, amount, Instant.now(clock).plus(defaultHorizon), sourceTransactionId);
    }

    /**
     * @throws IllegalStateException if the expiration is no longer pending
     */
    @Transactional
    public void cancel(UUID expirationId) {
        if (repository.cancel(expirationId) == 1) {
            log.info("Cancelled coin expiration: id={}", expirationId);
            return;
        }
        CoinExpiration existing = get(expirationId);
        throw new IllegalStateException("Coin expiration " + expirationId + " is " + existing.getStatus());
    }

    @Transactional(readOnly = true)
    public CoinExpiration get(UUID expirationId) {
        return repository.findById(expirationId)
            .map(CoinExpirationEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Coin expiration", expirationId));
    }

    @Transactional(readOnly = true)
    public List<CoinExpiration> findForUser(String userId) {
        return repository.findByUserIdOrderByScheduledExpiryDateAsc(userId).stream()
            .map(CoinExpirationEntity::toDomain)
            .toList();
    }
}
