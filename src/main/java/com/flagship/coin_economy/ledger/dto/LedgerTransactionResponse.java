package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.LedgerEntry;
import com.flagship.coin_economy.ledger.LedgerTransaction;
import com.flagship.coin_economy.ledger.TransactionStatus;
import com.flagship.coin_economy.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LedgerTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("entries")
    List<EntryResponse> entries;

    public static LedgerTransactionResponse from(LedgerTransaction transaction, List<LedgerEntry> entries) {
        return LedgerTransactionResponse.builder()
            .id(transaction.getId())
            .type(transaction.getType())
            .idempotencyKey(transaction.getIdempotencyKey())
            .status(transaction.getStatus())
            .metadata(transaction.getMetadata())
            .failureReason(transaction.getFailureReason())
            .createdAt(transaction.getCreatedAt())
            .entries(entries.stream().map(EntryResponse::from).toList())
            .build();
    }
}
