package com.flagship.coin_economy.observability;

import com.flagship.coin_economy.treasury.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database query, so a Prometheus scrape
 * never does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final TreasuryService treasuryService;
    private final EconomyMetrics economyMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshTreasuryMetrics() {
        try {
            economyMetrics.updateTreasuryGauges(treasuryService.getState());
        } catch (Exception e) {
            log.warn("Failed to refresh treasury metrics: {}", e.getMessage());
        }
    }
}
