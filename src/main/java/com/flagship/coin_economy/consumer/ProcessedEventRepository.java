package com.flagship.coin_economy.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    Optional<ProcessedEventEntity> findByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByEventIdOrderByProcessedAtAsc(UUID eventId);
}
