package com.flagship.coin_economy.scheduler;

import com.flagship.coin_economy.expiration.ExpirationProcessor;
import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.reconciliation.BalanceReconciliationJob;
import com.flagship.coin_economy.reconciliation.ReconciliationReport;
import com.flagship.coin_economy.refund.RefundProcessor;
import com.flagship.coin_economy.treasury.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual triggers for the batch jobs, for operators and backfills. Every job
 * is safe to run while its scheduled run is in progress.
 */
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final RefundProcessor refundProcessor;
    private final ExpirationProcessor expirationProcessor;
    private final BalanceReconciliationJob reconciliationJob;
    private final TreasuryService treasuryService;

    @PostMapping("/refunds/run")
    public ResponseEntity<JobRunSummary> runRefunds() {
        log.info("Manual trigger: bot refunds");
        return ResponseEntity.ok(refundProcessor.processDueRefunds());
    }

    @PostMapping("/expirations/run")
    public ResponseEntity<JobRunSummary> runExpirations() {
        log.info("Manual trigger: coin expirations");
        return ResponseEntity.ok(expirationProcessor.processDueExpirations());
    }

    @PostMapping("/reconciliation/run")
    public ResponseEntity<ReconciliationReport> runReconciliation() {
        log.info("Manual trigger: balance reconciliation");
        return ResponseEntity.ok(reconciliationJob.run());
    }

    @PostMapping("/daily-reset/run")
    public ResponseEntity<Map<String, Boolean>> runDailyReset() {
        return ResponseEntity.ok(Map.of("reset", treasuryService.resetDailySpend()));
    }
}
