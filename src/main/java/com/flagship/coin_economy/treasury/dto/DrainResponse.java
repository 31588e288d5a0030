package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.treasury.DrainResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class DrainResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("percentage")
    int percentage;

    @JsonProperty("previous_balance")
    long previousBalance;

    @JsonProperty("drained_amount")
    long drainedAmount;

    @JsonProperty("new_balance")
    long newBalance;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static DrainResponse from(DrainResult result) {
        return DrainResponse.builder()
            .userId(result.getUserId())
            .percentage(result.getPercentage())
            .previousBalance(result.getPreviousBalance())
            .drainedAmount(result.getDrainedAmount())
            .newBalance(result.getNewBalance())
            .transactionId(result.getTransactionId())
            .duplicate(result.isDuplicate())
            .build();
    }
}
