package com.flagship.coin_economy.expiration;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled expiry of coins in a user's wallet.
 *
 * {@code expiredAmount} is the most that may be taken; the processor takes
 * {@code min(balance, expiredAmount)} and records it as {@code actualExpiredAmount}.
 */
@Value
public class CoinExpiration {
    UUID id;
    String userId;
    UUID sourceTransactionId;
    long originalAmount;
    long expiredAmount;
    Long actualExpiredAmount;
    Instant scheduledExpiryDate;
    Instant actualExpiredAt;
    ExpirationStatus status;
    UUID expirationTransactionId;
    boolean notificationSent;
    Instant notificationSentAt;
    Instant createdAt;

    public boolean isPending() {
        return status == ExpirationStatus.PENDING;
    }
}
