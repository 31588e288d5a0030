package com.flagship.coin_economy.scheduler;

import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.refund.RefundProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily bot refund run.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   refunds:
 *     enabled: true
 *     cron: "0 0 3 * * *"     # 03:00 in economy.zone
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "scheduler.refunds.enabled", havingValue = "true", matchIfMissing = true)
public class RefundScheduler {

    private final RefundProcessor refundProcessor;

    @Scheduled(cron = "${scheduler.refunds.cron:0 0 3 * * *}", zone = "${economy.zone:UTC}")
    public void processRefunds() {
        log.info("Starting scheduled job: bot refunds");
        try {
            JobRunSummary summary = refundProcessor.processDueRefunds();
            if (summary.getFailed() > 0) {
                log.warn("Bot refunds finished with {} failed candidates", summary.getFailed());
            }
        } catch (Exception e) {
            log.error("Bot refund run failed: {}", e.getMessage(), e);
        }
    }
}
