package com.flagship.coin_economy.expiration;

import com.flagship.coin_economy.exception.EconomyException;
import com.flagship.coin_economy.exception.NotificationFailedException;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import com.flagship.coin_economy.jobs.BatchSupport;
import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.ledger.Counterparty;
import com.flagship.coin_economy.ledger.LedgerService;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.TransactionRequest;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.TransactionType;
import com.flagship.coin_economy.ledger.Wallet;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.notification.CoinExpirationNotice;
import com.flagship.coin_economy.notification.NotificationGateway;
import com.flagship.coin_economy.observability.CorrelationContext;
import com.flagship.coin_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Takes expired coins out of user wallets.
 *
 * Per due record, in one transaction: lock the record, lock the user's wallet
 * together with the counterparty wallet, debit {@code min(balance, expiredAmount)}
 * and mark the record processed. A user who spent down below the expiring
 * amount never goes negative; a record that finds nothing to take is still
 * processed, without a ledger transaction.
 *
 * The notice is sent after the debit has committed and only for a non-zero
 * debit. A failed notice does not undo the debit; the record stays flagged as
 * unnotified and later runs retry it.
 */
@Service
@Slf4j
public class ExpirationProcessor {

    static final String JOB_NAME = "coin-expirations";
    static final String EXPIRATION_KEY_PREFIX = "coin-expiration-";
    private static final String NOTIFICATION_CHANNEL = "coin_expiration";

    private final CoinExpirationRepository repository;
    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final NotificationGateway notificationGateway;
    private final BatchSupport batchSupport;
    private final EconomyMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate itemTemplate;
    private final Counterparty counterparty;
    private final int batchSize;
    private final Duration notificationTimeout;
    private final long interItemDelayMs;
    private final Duration maxRunDuration;

    public ExpirationProcessor(CoinExpirationRepository repository,
                               WalletService walletService,
                               LedgerService ledgerService,
                               NotificationGateway notificationGateway,
                               BatchSupport batchSupport,
                               EconomyMetrics metrics,
                               Clock clock,
                               PlatformTransactionManager transactionManager,
                               @Value("${economy.expiration.counterparty:VOID}") Counterparty counterparty,
                               @Value("${economy.expiration.batch-size:500}") int batchSize,
                               @Value("${economy.expiration.item-timeout-seconds:30}") int itemTimeoutSeconds,
                               @Value("${economy.expiration.notification-timeout-ms:5000}") long notificationTimeoutMs,
                               @Value("${economy.expiration.inter-item-delay-ms:0}") long interItemDelayMs,
                               @Value("${economy.expiration.max-run-duration-ms:900000}") long maxRunDurationMs) {
        this.repository = repository;
        this.walletService = walletService;
        this.ledgerService = ledgerService;
        this.notificationGateway = notificationGateway;
        this.batchSupport = batchSupport;
        this.metrics = metrics;
        this.clock = clock;
        this.itemTemplate = new TransactionTemplate(transactionManager);
        this.itemTemplate.setTimeout(itemTimeoutSeconds);
        this.counterparty = counterparty;
        this.batchSize = batchSize;
        this.notificationTimeout = Duration.ofMillis(notificationTimeoutMs);
        this.interItemDelayMs = interItemDelayMs;
        this.maxRunDuration = Duration.ofMillis(maxRunDurationMs);
    }

    public JobRunSummary processDueExpirations() {
        long started = System.currentTimeMillis();
        Instant deadline = Instant.now(clock).plus(maxRunDuration);
        try (CorrelationContext.Scope ignored = CorrelationContext.beginJob(JOB_NAME)) {
            List<UUID> due = repository.findDue(Instant.now(clock), batchSize).stream()
                .map(CoinExpirationEntity::getId)
                .toList();
            log.info("Processing coin expirations: candidates={}, counterparty={}", due.size(), counterparty);

            int processed = 0;
            int failed = 0;
            int skipped = 0;
            int deferred = 0;
            int notificationFailures = 0;
            long totalAmount = 0;
            Set<UUID> notifiedThisRun = new HashSet<>();

            for (int i = 0; i < due.size(); i++) {
                if (Instant.now(clock).isAfter(deadline)) {
                    deferred += due.size() - i;
                    log.warn("Expiration run reached its time limit, deferring {} records", due.size() - i);
                    break;
                }
                UUID recordId = due.get(i);
                try {
                    Optional<ExpiredRecord> outcome = expireRecord(recordId);
                    if (outcome.isEmpty()) {
                        skipped++;
                    } else {
                        processed++;
                        ExpiredRecord expired = outcome.get();
                        long amount = expired.getRecord().getActualExpiredAmount();
                        totalAmount += amount;
                        if (amount > 0 && !expired.getRecord().isNotificationSent()) {
                            notifiedThisRun.add(recordId);
                            if (!notify(expired.getRecord(), expired.getRemainingBalance())) {
                                notificationFailures++;
                            }
                        }
                    }
                } catch (RuntimeException e) {
                    failed++;
                    metrics.recordJobItemFailure(JOB_NAME, errorCode(e));
                    log.error("Coin expiration {} failed, leaving it pending: {}", recordId, e.getMessage(), e);
                }
                if (!batchSupport.pause(interItemDelayMs)) {
                    deferred += due.size() - i - 1;
                    break;
                }
            }

            if (Instant.now(clock).isBefore(deadline)) {
                notificationFailures += retryNotifications(notifiedThisRun);
            }

            JobRunSummary summary = JobRunSummary.builder()
                .jobName(JOB_NAME)
                .candidates(due.size())
                .processed(processed)
                .failed(failed)
                .skipped(skipped)
                .deferred(deferred)
                .totalAmount(totalAmount)
                .notificationFailures(notificationFailures)
                .durationMs(System.currentTimeMillis() - started)
                .build();
            metrics.recordJobRun(summary);
            log.info("Coin expirations complete: candidates={}, processed={}, failed={}, skipped={}, deferred={}, " +
                    "coins={}, notificationFailures={}, duration={}ms",
                    summary.getCandidates(), processed, failed, skipped, deferred, totalAmount,
                    notificationFailures, summary.getDurationMs());
            return summary;
        }
    }

    /**
     * Expires one record in its own transaction.
     *
     * @return empty if the record was no longer pending
     */
    Optional<ExpiredRecord> expireRecord(UUID recordId) {
        return Optional.ofNullable(itemTemplate.execute(status -> {
            CoinExpirationEntity entity = repository.findByIdForUpdate(recordId).orElse(null);
            if (entity == null || entity.getStatus() != ExpirationStatus.PENDING) {
                log.info("Coin expiration {} no longer pending, skipping", recordId);
                return null;
            }

            Wallet wallet = walletService.findWallet(entity.getUserId(), OwnerKind.USER)
                .orElseThrow(() -> new WalletNotFoundException(entity.getUserId(), OwnerKind.USER));
            MDC.put(CorrelationContext.WALLET_ID_MDC_KEY, wallet.getId().toString());
            try {
                // Lock the user and the counterparty together so lock order matches every other commit.
                Map<UUID, Wallet> locked = ledgerService.lockWallets(List.of(wallet.getId(), counterparty.walletId()));
                long balance = locked.get(wallet.getId()).getBalance();
                long actualAmount = Math.min(Math.max(balance, 0), entity.getExpiredAmount());

                UUID transactionId = null;
                long remainingBalance = balance;
                if (actualAmount > 0) {
                    TransactionResult result = ledgerService.commit(TransactionRequest.builder()
                        .type(TransactionType.EXPIRATION)
                        .idempotencyKey(EXPIRATION_KEY_PREFIX + recordId)
                        .entry(TransactionRequest.EntryLine.debit(wallet.getId(), actualAmount, "Coins expired"))
                        .counterparty(counterparty)
                        .metadata(Map.of(
                            "expirationId", recordId.toString(),
                            "userId", entity.getUserId(),
                            "scheduledAmount", entity.getExpiredAmount()))
                        .build());
                    transactionId = result.getTransactionId();
                    remainingBalance = result.balanceOf(wallet.getId());
                }

                entity.markProcessed(actualAmount, transactionId, Instant.now(clock));
                log.info("Expired coins: expirationId={}, userId={}, scheduled={}, actual={}, remaining={}",
                        recordId, entity.getUserId(), entity.getExpiredAmount(), actualAmount, remainingBalance);
                return new ExpiredRecord(entity.toDomain(), remainingBalance);
            } finally {
                MDC.remove(CorrelationContext.WALLET_ID_MDC_KEY);
            }
        }));
    }

    /**
     * Enqueues the notice within the notification timeout and flags the record.
     *
     * @return false if the notice could not be enqueued
     */
    boolean notify(CoinExpiration record, long remainingBalance) {
        CoinExpirationNotice notice = CoinExpirationNotice.of(record.getId(), record.getUserId(),
            record.getActualExpiredAmount(), record.getScheduledExpiryDate(), record.getActualExpiredAt(),
            remainingBalance);
        try {
            batchSupport.runWithTimeout(() -> notificationGateway.sendCoinExpiration(notice), notificationTimeout);
            repository.markNotificationSent(record.getId(), Instant.now(clock));
            return true;
        } catch (TimeoutException e) {
            return notificationFailed(record, new NotificationFailedException(
                "Notification timed out after " + notificationTimeout.toMillis() + "ms", e));
        } catch (RuntimeException e) {
            return notificationFailed(record, new NotificationFailedException(
                "Notification could not be enqueued: " + e.getMessage(), e));
        }
    }

    private boolean notificationFailed(CoinExpiration record, NotificationFailedException failure) {
        metrics.recordNotificationFailed(NOTIFICATION_CHANNEL);
        log.warn("NotificationFailed: expirationId={}, userId={}, amount={}, reason={}",
                record.getId(), record.getUserId(), record.getActualExpiredAmount(), failure.getMessage());
        return false;
    }

    /**
     * Retries notices that failed on earlier runs.
     */
    private int retryNotifications(Set<UUID> attemptedThisRun) {
        List<CoinExpiration> unnotified = repository.findUnnotified(batchSize).stream()
            .map(CoinExpirationEntity::toDomain)
            .filter(record -> !attemptedThisRun.contains(record.getId()))
            .toList();
        int failures = 0;
        for (CoinExpiration record : unnotified) {
            long balance = walletService.findWallet(record.getUserId(), OwnerKind.USER)
                .map(Wallet::getBalance)
                .orElse(0L);
            if (!notify(record, balance)) {
                failures++;
            }
        }
        if (!unnotified.isEmpty()) {
            log.info("Retried expiration notices: attempted={}, failed={}", unnotified.size(), failures);
        }
        return failures;
    }

    private static String errorCode(RuntimeException e) {
        return e instanceof EconomyException ? ((EconomyException) e).getErrorCode() : e.getClass().getSimpleName();
    }

    @lombok.Value
    static class ExpiredRecord {
        CoinExpiration record;
        long remainingBalance;
    }
}
