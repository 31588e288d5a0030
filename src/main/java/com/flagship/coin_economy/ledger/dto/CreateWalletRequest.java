package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.OwnerKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class CreateWalletRequest {

    @NotBlank(message = "Owner ID is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotNull(message = "Owner kind is required")
    @JsonProperty("owner_kind")
    OwnerKind ownerKind;

    @PositiveOrZero(message = "Spend cap cannot be negative")
    @JsonProperty("spend_cap")
    Long spendCap;
}
