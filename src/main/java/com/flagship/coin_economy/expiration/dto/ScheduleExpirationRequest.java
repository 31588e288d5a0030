package com.flagship.coin_economy.expiration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Without {@code expires_at} the default retention horizon applies.
 */
@Value
public class ScheduleExpirationRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("source_transaction_id")
    UUID sourceTransactionId;
}
