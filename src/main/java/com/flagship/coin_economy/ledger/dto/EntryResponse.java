package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.EntryDirection;
import com.flagship.coin_economy.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("direction")
    EntryDirection direction;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("balance_before")
    long balanceBefore;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EntryResponse from(LedgerEntry entry) {
        return EntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .walletId(entry.getWalletId())
            .direction(entry.getDirection())
            .amount(entry.getAmount())
            .balanceBefore(entry.getBalanceBefore())
            .balanceAfter(entry.getBalanceAfter())
            .memo(entry.getMemo())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
