package com.flagship.coin_economy.bot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.bot.BotAction;
import com.flagship.coin_economy.bot.BotActionType;
import com.flagship.coin_economy.bot.TargetType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BotActionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("bot_id")
    String botId;

    @JsonProperty("action_type")
    BotActionType actionType;

    @JsonProperty("target_type")
    TargetType targetType;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("coin_cost")
    long coinCost;

    @JsonProperty("refundable")
    boolean refundable;

    @JsonProperty("was_refunded")
    boolean wasRefunded;

    @JsonProperty("ledger_transaction_id")
    UUID ledgerTransactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BotActionResponse from(BotAction action) {
        return BotActionResponse.builder()
            .id(action.getId())
            .botId(action.getBotId())
            .actionType(action.getActionType())
            .targetType(action.getTarget().getType())
            .targetId(action.getTarget().getId())
            .coinCost(action.getCoinCost())
            .refundable(action.isRefundable())
            .wasRefunded(action.isWasRefunded())
            .ledgerTransactionId(action.getLedgerTransactionId())
            .createdAt(action.getCreatedAt())
            .build();
    }
}
