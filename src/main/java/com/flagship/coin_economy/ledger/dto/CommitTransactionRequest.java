package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.Counterparty;
import com.flagship.coin_economy.ledger.EntryDirection;
import com.flagship.coin_economy.ledger.TransactionRequest;
import com.flagship.coin_economy.ledger.TransactionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for posting a ledger transaction directly.
 */
@Value
public class CommitTransactionRequest {

    @NotNull(message = "Transaction type is required")
    @JsonProperty("type")
    TransactionType type;

    @NotEmpty(message = "At least one entry is required")
    @Valid
    @JsonProperty("entries")
    List<Entry> entries;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("allow_overdraft")
    boolean allowOverdraft;

    @JsonProperty("counterparty")
    Counterparty counterparty;

    public TransactionRequest toTransactionRequest(String idempotencyKey) {
        TransactionRequest.TransactionRequestBuilder builder = TransactionRequest.builder()
            .type(type)
            .idempotencyKey(idempotencyKey)
            .allowOverdraft(allowOverdraft)
            .counterparty(counterparty);
        for (Entry entry : entries) {
            builder.entry(TransactionRequest.EntryLine.of(
                entry.getWalletId(), entry.getDirection(), entry.getAmount(), entry.getMemo()));
        }
        if (metadata != null) {
            builder.metadata(metadata);
        }
        return builder.build();
    }

    @Value
    public static class Entry {

        @NotNull(message = "Wallet ID is required")
        @JsonProperty("wallet_id")
        UUID walletId;

        @NotNull(message = "Direction is required")
        @JsonProperty("direction")
        EntryDirection direction;

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than 0")
        @JsonProperty("amount")
        Long amount;

        @JsonProperty("memo")
        String memo;
    }
}
