package com.flagship.coin_economy.bot;

import com.flagship.coin_economy.exception.AlreadyRefundedException;
import com.flagship.coin_economy.exception.InvalidEntrySetException;
import com.flagship.coin_economy.exception.ResourceNotFoundException;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.Wallet;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.refund.BotRefundRepository;
import com.flagship.coin_economy.treasury.TreasuryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records bot spends and their refund eligibility.
 *
 * The treasury debit and the action row are written in one database
 * transaction, so an action always points at a committed ledger transaction
 * and a committed bot spend always has its action.
 */
@Service
@Slf4j
public class BotActionRecorder {

    static final String SPEND_KEY_PREFIX = "bot-spend-";

    private final BotActionRepository actionRepository;
    private final BotRefundRepository refundRepository;
    private final TreasuryService treasuryService;
    private final WalletService walletService;
    private final Clock clock;
    private final boolean autoRefundPurchases;
    private final int refundHour;

    public BotActionRecorder(BotActionRepository actionRepository,
                             BotRefundRepository refundRepository,
                             TreasuryService treasuryService,
                             WalletService walletService,
                             Clock clock,
                             @Value("${economy.bot.auto-refund-purchases:true}") boolean autoRefundPurchases,
                             @Value("${economy.bot.refund-hour:3}") int refundHour) {
        this.actionRepository = actionRepository;
        this.refundRepository = refundRepository;
        this.treasuryService = treasuryService;
        this.walletService = walletService;
        this.clock = clock;
        this.autoRefundPurchases = autoRefundPurchases;
        this.refundHour = refundHour;
    }

    /**
     * Spends treasury coins on behalf of a bot and records the action.
     *
     * @param idempotencyKey optional; when given, a repeated call returns the
     *                       action recorded by the first call
     * @return the action id
     * @throws com.flagship.coin_economy.exception.CapExceededException if a spend cap would be exceeded
     * @throws com.flagship.coin_economy.exception.InsufficientBalanceException if the treasury is short
     */
    @Transactional
    public UUID recordSpend(String botId, BotActionType actionType, ActionTarget target,
                            long cost, Map<String, Object> metadata, String idempotencyKey) {
        if (cost <= 0) {
            throw new InvalidEntrySetException("Bot action cost must be positive: " + cost);
        }
        if (idempotencyKey != null) {
            Optional<BotActionEntity> existing = actionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Bot action already recorded: botId={}, key={}, actionId={}",
                        botId, idempotencyKey, existing.get().getId());
                return existing.get().getId();
            }
        }

        UUID actionId = UUID.randomUUID();
        String key = idempotencyKey != null ? idempotencyKey : SPEND_KEY_PREFIX + actionId;

        Map<String, Object> txMetadata = new HashMap<>(metadata != null ? metadata : Map.of());
        txMetadata.put("actionId", actionId.toString());
        txMetadata.put("actionType", actionType.name());
        txMetadata.put("target", target.toString());

        TransactionResult result = treasuryService.debitForBotSpend(
            botId, cost, actionType + " " + target, key, txMetadata);

        if (result.isDuplicate()) {
            // Another call with this key won the treasury lock first and has committed its action.
            return actionRepository.findByIdempotencyKey(key)
                .map(BotActionEntity::getId)
                .orElseThrow(() -> new IllegalStateException(
                    "Idempotency key " + key + " is owned by a ledger transaction with no bot action"));
        }

        UUID botWalletId = walletService.findWallet(botId, OwnerKind.BOT)
            .map(Wallet::getId)
            .orElseThrow(() -> new WalletNotFoundException(botId, OwnerKind.BOT));

        BotAction action = new BotAction(
            actionId,
            botId,
            botWalletId,
            actionType,
            target,
            cost,
            actionType.isRefundable(),
            false,
            null,
            result.getTransactionId(),
            key,
            metadata,
            Instant.now(clock)
        );
        actionRepository.saveAndFlush(BotActionEntity.fromDomain(action));

        log.info("Recorded bot action: actionId={}, botId={}, type={}, target={}, cost={}",
                actionId, botId, actionType, target, cost);

        if (autoRefundPurchases && actionType.isAutoRefund()) {
            Instant refundAt = nextRefundTime();
            refundRepository.upsertCandidate(UUID.randomUUID(), actionId, botId, cost,
                "Automatic " + actionType.name().toLowerCase() + " refund", refundAt, Instant.now(clock));
            log.info("Scheduled automatic refund: actionId={}, scheduledFor={}", actionId, refundAt);
        }
        return actionId;
    }

    /**
     * Marks an action refunded, exactly once.
     *
     * @throws AlreadyRefundedException if the action was already refunded
     * @throws ResourceNotFoundException if there is no such action
     */
    @Transactional
    public void markRefunded(UUID actionId) {
        int updated = actionRepository.markRefunded(actionId, Instant.now(clock));
        if (updated == 1) {
            log.debug("Marked bot action refunded: actionId={}", actionId);
            return;
        }
        if (actionRepository.existsById(actionId)) {
            throw new AlreadyRefundedException(actionId);
        }
        throw new ResourceNotFoundException("Bot action", actionId);
    }

    /**
     * Schedules an immediate refund for a refundable action.
     *
     * @return true if a pending candidate now exists for the action, false if
     *         a candidate is already being processed or was settled
     * @throws IllegalStateException if the action type is not refundable
     */
    @Transactional
    public boolean disqualify(UUID actionId, String reason) {
        BotAction action = getAction(actionId);
        if (!action.isRefundable()) {
            throw new IllegalStateException(action.getActionType() + " actions cannot be refunded");
        }
        if (action.isWasRefunded()) {
            throw new AlreadyRefundedException(actionId);
        }
        return scheduleImmediateRefund(action, reason);
    }

    /**
     * Schedules immediate refunds for every unrefunded refundable action on a
     * target, e.g. when the purchased content is rejected.
     *
     * @return number of candidates created or pulled forward
     */
    @Transactional
    public int disqualifyTarget(TargetType targetType, String targetId, String reason) {
        List<BotActionEntity> actions = actionRepository.findUnrefundedByTarget(targetType, targetId);
        int scheduled = 0;
        for (BotActionEntity entity : actions) {
            if (scheduleImmediateRefund(entity.toDomain(), reason)) {
                scheduled++;
            }
        }
        log.info("Disqualified target {}:{}: actions={}, refundsScheduled={}",
                targetType, targetId, actions.size(), scheduled);
        return scheduled;
    }

    @Transactional(readOnly = true)
    public BotAction getAction(UUID actionId) {
        return actionRepository.findById(actionId)
            .map(BotActionEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Bot action", actionId));
    }

    @Transactional(readOnly = true)
    public Optional<BotAction> findByIdempotencyKey(String idempotencyKey) {
        return actionRepository.findByIdempotencyKey(idempotencyKey).map(BotActionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<BotAction> getActionsForBot(String botId) {
        return actionRepository.findByBotIdOrderByCreatedAtDesc(botId).stream()
            .map(BotActionEntity::toDomain)
            .toList();
    }

    private boolean scheduleImmediateRefund(BotAction action, String reason) {
        Instant now = Instant.now(clock);
        boolean scheduled = refundRepository.upsertCandidate(UUID.randomUUID(), action.getId(), action.getBotId(),
            action.getCoinCost(), reason, now, now) == 1;
        if (scheduled) {
            log.info("Refund scheduled: actionId={}, botId={}, amount={}, reason={}",
                    action.getId(), action.getBotId(), action.getCoinCost(), reason);
        } else {
            log.info("Refund already in progress or settled: actionId={}", action.getId());
        }
        return scheduled;
    }

    /**
     * Next occurrence of the configured refund hour in the economy's zone.
     */
    Instant nextRefundTime() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime candidate = now.truncatedTo(ChronoUnit.DAYS).withHour(refundHour);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }
}
