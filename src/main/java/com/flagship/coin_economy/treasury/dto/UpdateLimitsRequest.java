package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Either limit may be omitted to keep its current value.
 */
@Value
public class UpdateLimitsRequest {

    @PositiveOrZero(message = "Daily spend cap cannot be negative")
    @JsonProperty("daily_spend_cap")
    Long dailySpendCap;

    @PositiveOrZero(message = "Bot wallet cap cannot be negative")
    @JsonProperty("bot_wallet_cap")
    Long botWalletCap;
}
