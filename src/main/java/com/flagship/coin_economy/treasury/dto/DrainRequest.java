package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class DrainRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotNull(message = "Percentage is required")
    @Min(value = 0, message = "Percentage must be between 0 and 100")
    @Max(value = 100, message = "Percentage must be between 0 and 100")
    @JsonProperty("percentage")
    Integer percentage;

    @NotBlank(message = "Actor is required")
    @JsonProperty("actor")
    String actor;
}
