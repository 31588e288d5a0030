package com.flagship.coin_economy.bot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class DisqualifyResponse {

    @JsonProperty("action_id")
    UUID actionId;

    @JsonProperty("refund_scheduled")
    boolean refundScheduled;
}
