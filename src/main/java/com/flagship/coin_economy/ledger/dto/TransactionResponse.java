package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a commit, first or replayed.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("resulting_balances")
    Map<UUID, Long> resultingBalances;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static TransactionResponse from(TransactionResult result) {
        return TransactionResponse.builder()
            .transactionId(result.getTransactionId())
            .type(result.getType())
            .idempotencyKey(result.getIdempotencyKey())
            .resultingBalances(result.getResultingBalances())
            .duplicate(result.isDuplicate())
            .build();
    }
}
