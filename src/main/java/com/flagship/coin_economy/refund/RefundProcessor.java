package com.flagship.coin_economy.refund;

import com.flagship.coin_economy.bot.BotActionRecorder;
import com.flagship.coin_economy.exception.EconomyException;
import com.flagship.coin_economy.jobs.BatchSupport;
import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.observability.CorrelationContext;
import com.flagship.coin_economy.observability.EconomyMetrics;
import com.flagship.coin_economy.treasury.TreasuryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reverses bot spends whose refund candidates are due.
 *
 * Each candidate is claimed in its own short transaction, then refunded in a
 * second transaction that flips the action's refunded flag, moves the coins
 * back to the treasury and marks the candidate processed. A refund therefore
 * either happens completely or not at all. Transient store failures put the
 * candidate back for the next run; anything else marks it FAILED for manual
 * inspection so no compensating entry is ever posted twice.
 */
@Service
@Slf4j
public class RefundProcessor {

    static final String JOB_NAME = "bot-refunds";
    static final String REFUND_KEY_PREFIX = "bot-refund-";

    private final BotRefundRepository refundRepository;
    private final BotActionRecorder actionRecorder;
    private final TreasuryService treasuryService;
    private final BatchSupport batchSupport;
    private final EconomyMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate itemTemplate;
    private final int batchSize;
    private final long interItemDelayMs;
    private final Duration maxRunDuration;
    private final Duration staleClaimAge;

    public RefundProcessor(BotRefundRepository refundRepository,
                           BotActionRecorder actionRecorder,
                           TreasuryService treasuryService,
                           BatchSupport batchSupport,
                           EconomyMetrics metrics,
                           Clock clock,
                           PlatformTransactionManager transactionManager,
                           @Value("${economy.refund.batch-size:500}") int batchSize,
                           @Value("${economy.refund.item-timeout-seconds:30}") int itemTimeoutSeconds,
                           @Value("${economy.refund.inter-item-delay-ms:100}") long interItemDelayMs,
                           @Value("${economy.refund.max-run-duration-ms:900000}") long maxRunDurationMs,
                           @Value("${economy.refund.stale-claim-minutes:60}") long staleClaimMinutes) {
        this.refundRepository = refundRepository;
        this.actionRecorder = actionRecorder;
        this.treasuryService = treasuryService;
        this.batchSupport = batchSupport;
        this.metrics = metrics;
        this.clock = clock;
        this.itemTemplate = new TransactionTemplate(transactionManager);
        this.itemTemplate.setTimeout(itemTimeoutSeconds);
        this.batchSize = batchSize;
        this.interItemDelayMs = interItemDelayMs;
        this.maxRunDuration = Duration.ofMillis(maxRunDurationMs);
        this.staleClaimAge = Duration.ofMinutes(staleClaimMinutes);
    }

    /**
     * Processes every refund candidate due now, then resets the daily bot spend.
     */
    public JobRunSummary processDueRefunds() {
        long started = System.currentTimeMillis();
        Instant deadline = Instant.now(clock).plus(maxRunDuration);
        try (CorrelationContext.Scope ignored = CorrelationContext.beginJob(JOB_NAME)) {
            int released = refundRepository.releaseStale(Instant.now(clock).minus(staleClaimAge));
            if (released > 0) {
                log.warn("Released {} stale refund claims", released);
            }

            List<RefundCandidate> due = refundRepository.findDue(Instant.now(clock), batchSize).stream()
                .map(BotRefundEntity::toDomain)
                .toList();
            log.info("Processing bot refunds: candidates={}", due.size());

            int processed = 0;
            int failed = 0;
            int skipped = 0;
            int deferred = 0;
            long totalAmount = 0;

            for (int i = 0; i < due.size(); i++) {
                if (Instant.now(clock).isAfter(deadline)) {
                    deferred += due.size() - i;
                    log.warn("Refund run reached its time limit, deferring {} candidates", due.size() - i);
                    break;
                }
                RefundCandidate candidate = due.get(i);
                switch (processCandidate(candidate)) {
                    case PROCESSED -> {
                        processed++;
                        totalAmount += candidate.getAmount();
                    }
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                    case DEFERRED -> deferred++;
                }
                if (!batchSupport.pause(interItemDelayMs)) {
                    deferred += due.size() - i - 1;
                    break;
                }
            }

            resetDailySpend();

            JobRunSummary summary = JobRunSummary.builder()
                .jobName(JOB_NAME)
                .candidates(due.size())
                .processed(processed)
                .failed(failed)
                .skipped(skipped)
                .deferred(deferred)
                .totalAmount(totalAmount)
                .durationMs(System.currentTimeMillis() - started)
                .build();
            metrics.recordJobRun(summary);
            log.info("Bot refunds complete: candidates={}, processed={}, failed={}, skipped={}, deferred={}, coins={}, duration={}ms",
                    summary.getCandidates(), processed, failed, skipped, deferred, totalAmount, summary.getDurationMs());
            return summary;
        }
    }

    private Outcome processCandidate(RefundCandidate candidate) {
        if (refundRepository.claim(candidate.getId(), Instant.now(clock)) != 1) {
            log.info("Refund candidate already claimed by another run: refundId={}", candidate.getId());
            return Outcome.SKIPPED;
        }

        try {
            TransactionResult result = itemTemplate.execute(status -> {
                actionRecorder.markRefunded(candidate.getBotActionId());
                TransactionResult refund = treasuryService.creditRefund(candidate.getBotId(), candidate.getAmount(),
                    candidate.getBotActionId(), REFUND_KEY_PREFIX + candidate.getBotActionId());
                refundRepository.markProcessed(candidate.getId(), refund.getTransactionId(), Instant.now(clock));
                return refund;
            });
            log.info("Refunded bot action: actionId={}, botId={}, amount={}, transactionId={}",
                    candidate.getBotActionId(), candidate.getBotId(), candidate.getAmount(), result.getTransactionId());
            return Outcome.PROCESSED;

        } catch (RuntimeException e) {
            String errorCode = e instanceof EconomyException ? ((EconomyException) e).getErrorCode() : e.getClass().getSimpleName();
            metrics.recordJobItemFailure(JOB_NAME, errorCode);
            if (BatchSupport.isTransient(e)) {
                log.warn("Transient failure refunding action {}, releasing for next run: {}",
                        candidate.getBotActionId(), e.getMessage());
                releaseClaim(candidate);
                return Outcome.DEFERRED;
            }
            log.error("Refund failed for action {}: {}", candidate.getBotActionId(), e.getMessage(), e);
            markFailed(candidate, e);
            return Outcome.FAILED;
        }
    }

    private void releaseClaim(RefundCandidate candidate) {
        try {
            refundRepository.release(candidate.getId());
        } catch (DataAccessException e) {
            log.error("Could not release refund claim {}, it will be released once stale: {}",
                    candidate.getId(), e.getMessage());
        }
    }

    private void markFailed(RefundCandidate candidate, RuntimeException cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        try {
            refundRepository.markFailed(candidate.getId(), reason, Instant.now(clock));
        } catch (DataAccessException e) {
            log.error("Could not mark refund {} failed, it will be released once stale: {}",
                    candidate.getId(), e.getMessage());
        }
    }

    private void resetDailySpend() {
        try {
            treasuryService.resetDailySpend();
        } catch (DataAccessException e) {
            log.error("Daily spend reset after refunds failed: {}", e.getMessage(), e);
        }
    }

    private enum Outcome {
        PROCESSED,
        FAILED,
        SKIPPED,
        DEFERRED
    }
}
