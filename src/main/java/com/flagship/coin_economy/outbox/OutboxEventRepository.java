package com.flagship.coin_economy.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Unpublished events in write order, skipping rows another publisher holds.
     * Events at the retry limit stay behind as dead letters.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit,
                                                          @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Rows of {aggregateType, count} for unpublished events.
     */
    @Query("""
        SELECT e.aggregateType, COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        GROUP BY e.aggregateType
        """)
    List<Object[]> countUnpublishedByAggregateType();

    @Query("""
        SELECT COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries
        """)
    long countDeadLetters(@Param("maxRetries") int maxRetries);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
