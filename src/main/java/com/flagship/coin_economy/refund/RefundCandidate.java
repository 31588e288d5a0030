package com.flagship.coin_economy.refund;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RefundCandidate {
    UUID id;
    UUID botActionId;
    String botId;
    long amount;
    String reason;
    RefundStatus status;
    Instant scheduledFor;
    Instant claimedAt;
    Instant processedAt;
    UUID refundTransactionId;
    String failureReason;
    Instant createdAt;
}
