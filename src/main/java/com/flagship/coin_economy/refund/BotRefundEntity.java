package com.flagship.coin_economy.refund;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for bot_refunds. Rows are created by an upsert and change state
 * only through the compare-and-set updates in {@link BotRefundRepository}.
 */
@Entity
@Table(name = "bot_refunds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BotRefundEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "bot_action_id", nullable = false, updatable = false, unique = true)
    private UUID botActionId;

    @Column(name = "bot_id", nullable = false, updatable = false, length = 100)
    private String botId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RefundStatus status;

    @Column(name = "scheduled_for", nullable = false)
    private Instant scheduledFor;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "refund_transaction_id")
    private UUID refundTransactionId;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public RefundCandidate toDomain() {
        return new RefundCandidate(
            id,
            botActionId,
            botId,
            amount,
            reason,
            status,
            scheduledFor,
            claimedAt,
            processedAt,
            refundTransactionId,
            failureReason,
            createdAt
        );
    }
}
