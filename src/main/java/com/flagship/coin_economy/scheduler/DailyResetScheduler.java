package com.flagship.coin_economy.scheduler;

import com.flagship.coin_economy.treasury.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Resets the daily bot spend shortly after midnight. The refund run resets it
 * too; whichever runs second is a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "scheduler.daily-reset.enabled", havingValue = "true", matchIfMissing = true)
public class DailyResetScheduler {

    private final TreasuryService treasuryService;

    @Scheduled(cron = "${scheduler.daily-reset.cron:0 5 0 * * *}", zone = "${economy.zone:UTC}")
    public void resetDailySpend() {
        try {
            treasuryService.resetDailySpend();
        } catch (Exception e) {
            log.error("Daily spend reset failed: {}", e.getMessage(), e);
        }
    }
}
