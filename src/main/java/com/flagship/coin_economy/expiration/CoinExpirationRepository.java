package com.flagship.coin_economy.expiration;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
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
public interface CoinExpirationRepository extends JpaRepository<CoinExpirationEntity, UUID> {

    /**
     * Row-locks a record so overlapping runs process it once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CoinExpirationEntity e WHERE e.id = :id")
    Optional<CoinExpirationEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Pending records due at or before {@code now}, oldest expiry first.
     */
    @Query(value = """
        SELECT * FROM coin_expirations
        WHERE status = 'PENDING' AND scheduled_expiry_date <= :now
        ORDER BY scheduled_expiry_date ASC, created_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<CoinExpirationEntity> findDue(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Processed records that took coins but whose notice was never enqueued.
     */
    @Query(value = """
        SELECT * FROM coin_expirations
        WHERE status = 'PROCESSED' AND notification_sent = FALSE AND actual_expired_amount > 0
        ORDER BY actual_expired_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<CoinExpirationEntity> findUnnotified(@Param("limit") int limit);

    List<CoinExpirationEntity> findByUserIdOrderByScheduledExpiryDateAsc(String userId);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE CoinExpirationEntity e
        SET e.notificationSent = true, e.notificationSentAt = :now
        WHERE e.id = :id AND e.notificationSent = false
        """)
    int markNotificationSent(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE CoinExpirationEntity e
        SET e.status = com.flagship.coin_economy.expiration.ExpirationStatus.CANCELLED
        WHERE e.id = :id AND e.status = com.flagship.coin_economy.expiration.ExpirationStatus.PENDING
        """)
    int cancel(@Param("id") UUID id);
}
