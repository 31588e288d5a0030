package com.flagship.coin_economy.scheduler;

import com.flagship.coin_economy.expiration.ExpirationProcessor;
import com.flagship.coin_economy.jobs.JobRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily coin expiration run, 04:00 in economy.zone by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "scheduler.expirations.enabled", havingValue = "true", matchIfMissing = true)
public class ExpirationScheduler {

    private final ExpirationProcessor expirationProcessor;

    @Scheduled(cron = "${scheduler.expirations.cron:0 0 4 * * *}", zone = "${economy.zone:UTC}")
    public void processExpirations() {
        log.info("Starting scheduled job: coin expirations");
        try {
            JobRunSummary summary = expirationProcessor.processDueExpirations();
            if (summary.getFailed() > 0 || summary.getNotificationFailures() > 0) {
                log.warn("Coin expirations finished with {} failed records and {} failed notices",
                        summary.getFailed(), summary.getNotificationFailures());
            }
        } catch (Exception e) {
            log.error("Coin expiration run failed: {}", e.getMessage(), e);
        }
    }
}
