package com.flagship.coin_economy.bot;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Record of one coin-spending bot action. Refunded at most once.
 */
@Value
public class BotAction {
    UUID id;
    String botId;
    UUID botWalletId;
    BotActionType actionType;
    ActionTarget target;
    long coinCost;
    boolean refundable;
    boolean wasRefunded;
    Instant refundedAt;
    UUID ledgerTransactionId;
    String idempotencyKey;
    Map<String, Object> metadata;
    Instant createdAt;
}
