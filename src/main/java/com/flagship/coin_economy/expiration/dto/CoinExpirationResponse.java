package com.flagship.coin_economy.expiration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.expiration.CoinExpiration;
import com.flagship.coin_economy.expiration.ExpirationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CoinExpirationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("expired_amount")
    long expiredAmount;

    @JsonProperty("actual_expired_amount")
    Long actualExpiredAmount;

    @JsonProperty("scheduled_expiry_date")
    Instant scheduledExpiryDate;

    @JsonProperty("actual_expired_at")
    Instant actualExpiredAt;

    @JsonProperty("status")
    ExpirationStatus status;

    @JsonProperty("expiration_transaction_id")
    UUID expirationTransactionId;

    @JsonProperty("notification_sent")
    boolean notificationSent;

    public static CoinExpirationResponse from(CoinExpiration expiration) {
        return CoinExpirationResponse.builder()
            .id(expiration.getId())
            .userId(expiration.getUserId())
            .expiredAmount(expiration.getExpiredAmount())
            .actualExpiredAmount(expiration.getActualExpiredAmount())
            .scheduledExpiryDate(expiration.getScheduledExpiryDate())
            .actualExpiredAt(expiration.getActualExpiredAt())
            .status(expiration.getStatus())
            .expirationTransactionId(expiration.getExpirationTransactionId())
            .notificationSent(expiration.isNotificationSent())
            .build();
    }
}
