package com.flagship.coin_economy.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class LedgerTransaction {
    UUID id;
    TransactionType type;
    String idempotencyKey;
    TransactionStatus status;
    Map<String, Object> metadata;
    String failureReason;
    Instant createdAt;
}
