package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.treasury.TreasuryState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Treasury snapshot as exposed over HTTP.
 */
@Value
@Builder
public class TreasuryResponse {

    @JsonProperty("treasury_wallet_id")
    UUID treasuryWalletId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("daily_spend_cap")
    long dailySpendCap;

    @JsonProperty("today_spent")
    long todaySpent;

    @JsonProperty("remaining_daily_budget")
    long remainingDailyBudget;

    @JsonProperty("last_reset_date")
    LocalDate lastResetDate;

    @JsonProperty("bot_wallet_cap")
    long botWalletCap;

    @JsonProperty("total_spent")
    long totalSpent;

    @JsonProperty("total_refunded")
    long totalRefunded;

    @JsonProperty("total_refilled")
    long totalRefilled;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TreasuryResponse from(TreasuryState state) {
        return TreasuryResponse.builder()
            .treasuryWalletId(state.getTreasuryWalletId())
            .balance(state.getTreasuryBalance())
            .dailySpendCap(state.getDailySpendCap())
            .todaySpent(state.getEffectiveTodaySpent())
            .remainingDailyBudget(state.getRemainingDailyBudget())
            .lastResetDate(state.getLastResetDate())
            .botWalletCap(state.getBotWalletCap())
            .totalSpent(state.getTotalSpent())
            .totalRefunded(state.getTotalRefunded())
            .totalRefilled(state.getTotalRefilled())
            .updatedAt(state.getUpdatedAt())
            .build();
    }
}
