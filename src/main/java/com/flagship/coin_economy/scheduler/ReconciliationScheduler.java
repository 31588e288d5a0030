package com.flagship.coin_economy.scheduler;

import com.flagship.coin_economy.reconciliation.BalanceReconciliationJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Weekly balance audit, Sunday 03:30 by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "scheduler.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private final BalanceReconciliationJob reconciliationJob;

    @Scheduled(cron = "${scheduler.reconciliation.cron:0 30 3 * * SUN}", zone = "${economy.zone:UTC}")
    public void reconcile() {
        log.info("Starting scheduled job: balance reconciliation");
        try {
            reconciliationJob.run();
        } catch (Exception e) {
            log.error("Balance reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
