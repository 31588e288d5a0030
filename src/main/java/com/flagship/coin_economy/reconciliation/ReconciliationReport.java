package com.flagship.coin_economy.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReconciliationReport {
    Instant checkedAt;
    int walletsChecked;
    int discrepanciesFound;
    long totalDrift;
    long globalBalanceSum;
    List<WalletDrift> topDrifts;      // largest first, at most 20
    ReconciliationStatus status;
    long durationMs;
}
