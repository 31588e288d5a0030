package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class RefillRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Actor is required")
    @JsonProperty("actor")
    String actor;
}
