package com.flagship.coin_economy.bot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.bot.BotActionType;
import com.flagship.coin_economy.bot.TargetType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.util.Map;

@Value
public class RecordActionRequest {

    @NotNull(message = "Action type is required")
    @JsonProperty("action_type")
    BotActionType actionType;

    @NotNull(message = "Target type is required")
    @JsonProperty("target_type")
    TargetType targetType;

    @NotBlank(message = "Target ID is required")
    @JsonProperty("target_id")
    String targetId;

    @NotNull(message = "Cost is required")
    @Positive(message = "Cost must be greater than 0")
    @JsonProperty("cost")
    Long cost;

    @JsonProperty("metadata")
    Map<String, Object> metadata;
}
