package com.flagship.coin_economy.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Tells a user that coins left their wallet because they expired.
 * {@code scheduledExpiryDate} is when the coins were due to expire and
 * {@code effectiveDate} is when the job removed them.
 */
@Value
public class CoinExpirationNotice {
    public static final String EVENT_TYPE = "CoinsExpired";

    UUID noticeId;
    UUID expirationId;
    String userId;
    long amount;
    String reason;
    Instant scheduledExpiryDate;
    Instant effectiveDate;
    long remainingBalance;

    public static CoinExpirationNotice of(UUID expirationId, String userId, long amount,
                                          Instant scheduledExpiryDate, Instant effectiveDate,
                                          long remainingBalance) {
        return new CoinExpirationNotice(
            UUID.randomUUID(),
            expirationId,
            userId,
            amount,
            "Coins expired after the retention period",
            scheduledExpiryDate,
            effectiveDate,
            remainingBalance
        );
    }
}
