package com.flagship.coin_economy.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.ledger.LedgerEntry;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.Wallet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wallet view with its most recent entries.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("owner_kind")
    OwnerKind ownerKind;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("lifetime_earned")
    long lifetimeEarned;

    @JsonProperty("lifetime_spent")
    long lifetimeSpent;

    @JsonProperty("spend_cap")
    Long spendCap;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("recent_entries")
    List<EntryResponse> recentEntries;

    public static WalletResponse from(Wallet wallet, List<LedgerEntry> recentEntries) {
        return WalletResponse.builder()
            .id(wallet.getId())
            .ownerId(wallet.getOwnerId())
            .ownerKind(wallet.getOwnerKind())
            .balance(wallet.getBalance())
            .lifetimeEarned(wallet.getLifetimeEarned())
            .lifetimeSpent(wallet.getLifetimeSpent())
            .spendCap(wallet.getSpendCap())
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .recentEntries(recentEntries.stream().map(EntryResponse::from).toList())
            .build();
    }
}
