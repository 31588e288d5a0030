package com.flagship.coin_economy.bot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class AffordabilityResponse {

    @JsonProperty("bot_id")
    String botId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("affordable")
    boolean affordable;
}
