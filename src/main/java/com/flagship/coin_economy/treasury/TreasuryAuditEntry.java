package com.flagship.coin_economy.treasury;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One admin action against the treasury, with the balance it changed before
 * and after.
 */
@Value
@Builder
public class TreasuryAuditEntry {
    UUID id;
    String actorId;
    TreasuryAuditAction action;
    String targetType;
    String targetId;
    long amount;
    Map<String, Object> previousValue;
    Map<String, Object> newValue;
    String reason;
    UUID ledgerTransactionId;
    Instant createdAt;
}
