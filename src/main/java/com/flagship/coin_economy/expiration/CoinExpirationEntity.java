package com.flagship.coin_economy.expiration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for coin_expirations.
 */
@Entity
@Table(name = "coin_expirations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CoinExpirationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 100)
    private String userId;

    @Column(name = "source_transaction_id", updatable = false)
    private UUID sourceTransactionId;

    @Column(name = "original_amount", nullable = false, updatable = false)
    private long originalAmount;

    @Column(name = "expired_amount", nullable = false, updatable = false)
    private long expiredAmount;

    @Column(name = "actual_expired_amount")
    private Long actualExpiredAmount;

    @Column(name = "scheduled_expiry_date", nullable = false, updatable = false)
    private Instant scheduledExpiryDate;

    @Column(name = "actual_expired_at")
    private Instant actualExpiredAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpirationStatus status;

    @Column(name = "expiration_transaction_id")
    private UUID expirationTransactionId;

    @Column(name = "notification_sent", nullable = false)
    private boolean notificationSent;

    @Column(name = "notification_sent_at")
    private Instant notificationSentAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static CoinExpirationEntity fromDomain(CoinExpiration expiration) {
        return new CoinExpirationEntity(
            expiration.getId(),
            expiration.getUserId(),
            expiration.getSourceTransactionId(),
            expiration.getOriginalAmount(),
            expiration.getExpiredAmount(),
            expiration.getActualExpiredAmount(),
            expiration.getScheduledExpiryDate(),
            expiration.getActualExpiredAt(),
            expiration.getStatus(),
            expiration.getExpirationTransactionId(),
            expiration.isNotificationSent(),
            expiration.getNotificationSentAt(),
            expiration.getCreatedAt()
        );
    }

    public CoinExpiration toDomain() {
        return new CoinExpiration(
            id,
            userId,
            sourceTransactionId,
            originalAmount,
            expiredAmount,
            actualExpiredAmount,
            scheduledExpiryDate,
            actualExpiredAt,
            status,
            expirationTransactionId,
            notificationSent,
            notificationSentAt,
            createdAt
        );
    }

    /**
     * Records the outcome of an expiration. {@code transactionId} is null when
     * nothing was left to expire.
     */
    void markProcessed(long actualAmount, UUID transactionId, Instant processedAt) {
        if (status != ExpirationStatus.PENDING) {
            throw new IllegalStateException("Coin expiration " + id + " is " + status + ", not PENDING");
        }
        this.status = ExpirationStatus.PROCESSED;
        this.actualExpiredAmount = actualAmount;
        this.expirationTransactionId = transactionId;
        this.actualExpiredAt = processedAt;
    }
}
