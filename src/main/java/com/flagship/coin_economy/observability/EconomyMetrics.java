package com.flagship.coin_economy.observability;

import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.ledger.TransactionType;
import com.flagship.coin_economy.reconciliation.ReconciliationReport;
import com.flagship.coin_economy.treasury.TreasuryState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics for the coin economy.
 *
 * Metrics exposed:
 * - ledger.transactions: committed/failed/replayed transactions by type
 * - ledger.commit.duration: Timer for engine commits
 * - treasury.bot_spend: bot spends by outcome
 * - treasury.wallet_drain.coins: platform fees drained into the treasury
 * - treasury.balance, treasury.today_spent, treasury.daily_remaining: gauges
 * - economy.job.*: per-run counters for refund and expiration jobs
 * - economy.notifications.failed: notifications that could not be enqueued
 * - economy.reconciliation.*: outcome of the weekly balance audit
 */
@Component
public class EconomyMetrics {

    private final MeterRegistry registry;
    private final Timer commitTimer;

    private final AtomicLong treasuryBalance = new AtomicLong(0);
    private final AtomicLong treasuryTodaySpent = new AtomicLong(0);
    private final AtomicLong treasuryDailyRemaining = new AtomicLong(0);
    private final AtomicLong reconciliationDiscrepancies = new AtomicLong(0);
    private final AtomicLong reconciliationGlobalSum = new AtomicLong(0);

    public EconomyMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.commitTimer = Timer.builder("ledger.commit.duration")
                .description("Time taken to commit a ledger transaction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("treasury.balance", treasuryBalance, AtomicLong::get)
                .description("Treasury wallet balance in coins")
                .register(registry);

        Gauge.builder("treasury.today_spent", treasuryTodaySpent, AtomicLong::get)
                .description("Coins spent by bots today")
                .register(registry);

        Gauge.builder("treasury.daily_remaining", treasuryDailyRemaining, AtomicLong::get)
                .description("Coins bots may still spend today")
                .register(registry);

        Gauge.builder("economy.reconciliation.discrepancies", reconciliationDiscrepancies, AtomicLong::get)
                .description("Wallets whose cached balance drifted from their entries at the last reconciliation")
                .register(registry);

        Gauge.builder("economy.reconciliation.global_sum", reconciliationGlobalSum, AtomicLong::get)
                .description("Sum of all wallet balances at the last reconciliation, expected to be zero")
                .register(registry);
    }

    // ==================== Ledger ====================

    public <T> T timeCommit(Supplier<T> operation) {
        return commitTimer.record(operation);
    }

    public void recordTransactionCommitted(TransactionType type) {
        registry.counter("ledger.transactions",
                "type", type.name(),
                "status", "committed"
        ).increment();
    }

    public void recordTransactionFailed(TransactionType type, String errorCode) {
        registry.counter("ledger.transactions",
                "type", type != null ? type.name() : "unknown",
                "status", "failed",
                "error", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordIdempotentReplay(TransactionType type) {
        registry.counter("ledger.transactions",
                "type", type.name(),
                "status", "replayed"
        ).increment();
    }

    // ==================== Treasury ====================

    public void recordBotSpend(String outcome, long amount) {
        registry.counter("treasury.bot_spend", "outcome", sanitizeTag(outcome)).increment();
        if (amount > 0) {
            registry.counter("treasury.bot_spend.coins", "outcome", sanitizeTag(outcome)).increment(amount);
        }
    }

    public void recordWalletDrain(long amount) {
        registry.counter("treasury.wallet_drain.coins").increment(amount);
    }

    public void recordDailyReset(boolean reset) {
        registry.counter("treasury.daily_reset", "applied", String.valueOf(reset)).increment();
    }

    public void updateTreasuryGauges(TreasuryState state) {
        treasuryBalance.set(state.getTreasuryBalance());
        treasuryTodaySpent.set(state.getEffectiveTodaySpent());
        treasuryDailyRemaining.set(state.getRemainingDailyBudget());
    }

    // ==================== Jobs ====================

    public void recordJobRun(JobRunSummary summary) {
        String job = summary.getJobName();
        registry.counter("economy.job.processed", "job", job).increment(summary.getProcessed());
        registry.counter("economy.job.failed", "job", job).increment(summary.getFailed());
        registry.counter("economy.job.skipped", "job", job).increment(summary.getSkipped());
        registry.counter("economy.job.deferred", "job", job).increment(summary.getDeferred());
        registry.counter("economy.job.coins", "job", job).increment(summary.getTotalAmount());
        registry.timer("economy.job.duration", "job", job).record(Duration.ofMillis(summary.getDurationMs()));
    }

    public void recordJobItemFailure(String job, String errorCode) {
        registry.counter("economy.job.item_failures",
                "job", job,
                "error", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordReconciliation(ReconciliationReport report) {
        registry.counter("economy.reconciliation.runs", "status", report.getStatus().name()).increment();
        reconciliationDiscrepancies.set(report.getDiscrepanciesFound());
        reconciliationGlobalSum.set(report.getGlobalBalanceSum());
    }

    public void recordNotificationFailed(String channel) {
        registry.counter("economy.notifications.failed", "channel", sanitizeTag(channel)).increment();
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
