package com.flagship.coin_economy.treasury;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Snapshot of the treasury_state row joined with the treasury wallet balance,
 * read on {@code asOf} in the economy zone.
 */
@Value
@Builder(toBuilder = true)
public class TreasuryState {
    UUID treasuryWalletId;
    long treasuryBalance;
    long dailySpendCap;
    long todaySpent;
    LocalDate lastResetDate;
    long botWalletCap;
    long totalSpent;
    long totalRefunded;
    long totalRefilled;
    Instant updatedAt;
    LocalDate asOf;

    /**
     * Today's spend as the cap sees it: a counter last reset on an earlier day
     * no longer counts against today.
     */
    public long effectiveTodaySpent(LocalDate today) {
        return lastResetDate.isBefore(today) ? 0 : todaySpent;
    }

    public long getEffectiveTodaySpent() {
        return effectiveTodaySpent(asOf);
    }

    public long getRemainingDailyBudget() {
        return Math.max(0, dailySpendCap - getEffectiveTodaySpent());
    }
}
