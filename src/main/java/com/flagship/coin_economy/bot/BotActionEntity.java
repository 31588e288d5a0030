package com.flagship.coin_economy.bot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for bot_actions.
 *
 * No setters: the refunded flag only changes through the compare-and-set
 * update in {@link BotActionRepository#markRefunded}.
 */
@Entity
@Table(name = "bot_actions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BotActionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "bot_id", nullable = false, updatable = false, length = 100)
    private String botId;

    @Column(name = "bot_wallet_id", nullable = false, updatable = false)
    private UUID botWalletId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 30)
    private BotActionType actionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, updatable = false, length = 30)
    private TargetType targetType;

    @Column(name = "target_id", nullable = false, updatable = false, length = 100)
    private String targetId;

    @Column(name = "coin_cost", nullable = false, updatable = false)
    private long coinCost;

    @Column(nullable = false, updatable = false)
    private boolean refundable;

    @Column(name = "was_refunded", nullable = false)
    private boolean wasRefunded;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "ledger_transaction_id", nullable = false, updatable = false)
    private UUID ledgerTransactionId;

    @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true)
    private String idempotencyKey;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BotActionEntity fromDomain(BotAction action) {
        return new BotActionEntity(
            action.getId(),
            action.getBotId(),
            action.getBotWalletId(),
            action.getActionType(),
            action.getTarget().getType(),
            action.getTarget().getId(),
            action.getCoinCost(),
            action.isRefundable(),
            false,
            null,
            action.getLedgerTransactionId(),
            action.getIdempotencyKey(),
            action.getMetadata() != null ? new HashMap<>(action.getMetadata()) : null,
            action.getCreatedAt()
        );
    }

    public BotAction toDomain() {
        return new BotAction(
            id,
            botId,
            botWalletId,
            actionType,
            new ActionTarget(targetType, targetId),
            coinCost,
            refundable,
            wasRefunded,
            refundedAt,
            ledgerTransactionId,
            idempotencyKey,
            metadata,
            createdAt
        );
    }
}
