package com.flagship.coin_economy.bot;

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

@Repository
public interface BotActionRepository extends JpaRepository<BotActionEntity, UUID> {

    Optional<BotActionEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Flips the refunded flag only if it is still clear.
     *
     * @return 1 if this call refunded the action, 0 if it was already refunded or does not exist
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BotActionEntity a
        SET a.wasRefunded = true, a.refundedAt = :now
        WHERE a.id = :id AND a.wasRefunded = false
        """)
    int markRefunded(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Refundable actions on a target that have not been refunded yet.
     */
    @Query("""
        SELECT a FROM BotActionEntity a
        WHERE a.targetType = :targetType AND a.targetId = :targetId
        AND a.refundable = true AND a.wasRefunded = false
        ORDER BY a.createdAt ASC
        """)
    List<BotActionEntity> findUnrefundedByTarget(@Param("targetType") TargetType targetType,
                                                 @Param("targetId") String targetId);

    List<BotActionEntity> findByBotIdOrderByCreatedAtDesc(String botId);
}
