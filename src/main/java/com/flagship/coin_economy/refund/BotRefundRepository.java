package com.flagship.coin_economy.refund;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Refund candidates. Every state change is a compare-and-set on the current
 * status so overlapping processor runs cannot both act on one candidate.
 * Each update returns the number of rows changed: 1 means this caller won.
 */
@Repository
public interface BotRefundRepository extends JpaRepository<BotRefundEntity, UUID> {

    Optional<BotRefundEntity> findByBotActionId(UUID botActionId);

    /**
     * Pending candidates due at or before {@code now}, oldest first.
     */
    @Query(value = """
        SELECT * FROM bot_refunds
        WHERE status = 'PENDING' AND scheduled_for <= :now
        ORDER BY scheduled_for ASC, created_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<BotRefundEntity> findDue(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Creates a pending candidate for an action, or pulls an existing pending one
     * forward. Candidates already claimed, processed or failed are left alone.
     *
     * @return 1 if a candidate was created or rescheduled, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO bot_refunds (id, bot_action_id, bot_id, amount, reason, status, scheduled_for, created_at)
        VALUES (:id, :actionId, :botId, :amount, :reason, 'PENDING', :scheduledFor, :now)
        ON CONFLICT (bot_action_id) DO UPDATE
        SET scheduled_for = LEAST(bot_refunds.scheduled_for, EXCLUDED.scheduled_for),
            reason = EXCLUDED.reason
        WHERE bot_refunds.status = 'PENDING'
        """, nativeQuery = true)
    int upsertCandidate(@Param("id") UUID id,
                        @Param("actionId") UUID actionId,
                        @Param("botId") String botId,
                        @Param("amount") long amount,
                        @Param("reason") String reason,
                        @Param("scheduledFor") Instant scheduledFor,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotRefundEntity r
        SET r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSING, r.claimedAt = :now
        WHERE r.id = :id AND r.status = com.flagship.coin_economy.refund.RefundStatus.PENDING
        """)
    int claim(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotRefundEntity r
        SET r.status = com.flagship.coin_economy.refund.RefundStatus.PENDING, r.claimedAt = null
        WHERE r.id = :id AND r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSING
        """)
    int release(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotRefundEntity r
        SET r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSED,
            r.processedAt = :now, r.refundTransactionId = :transactionId
        WHERE r.id = :id AND r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSING
        """)
    int markProcessed(@Param("id") UUID id, @Param("transactionId") UUID transactionId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotRefundEntity r
        SET r.status = com.flagship.coin_economy.refund.RefundStatus.FAILED,
            r.processedAt = :now, r.failureReason = :reason
        WHERE r.id = :id AND r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSING
        """)
    int markFailed(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

    /**
     * Returns claims left behind by a run that died mid-item.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotRefundEntity r
        SET r.status = com.flagship.coin_economy.refund.RefundStatus.PENDING, r.claimedAt = null
        WHERE r.status = com.flagship.coin_economy.refund.RefundStatus.PROCESSING AND r.claimedAt < :cutoff
        """)
    int releaseStale(@Param("cutoff") Instant cutoff);
}
