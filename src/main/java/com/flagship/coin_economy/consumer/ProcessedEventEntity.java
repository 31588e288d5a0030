package com.flagship.coin_economy.consumer;

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
 * One consumer group's verdict on one event. The unique (event_id, consumer_group)
 * constraint is what makes handling exactly-once per group.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity {

    static final int MAX_DETAIL_LENGTH = 2000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    static ProcessedEventEntity of(UUID eventId, String eventType, String aggregateType, String aggregateId,
                                   String consumerGroup, ProcessingResult result, String detail, Instant at) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.id = UUID.randomUUID();
        entity.eventId = eventId;
        entity.eventType = eventType;
        entity.aggregateType = aggregateType;
        entity.aggregateId = aggregateId;
        entity.consumerGroup = consumerGroup;
        entity.processingResult = result;
        entity.errorMessage = detail != null && detail.length() > MAX_DETAIL_LENGTH
            ? detail.substring(0, MAX_DETAIL_LENGTH)
            : detail;
        entity.processedAt = at;
        return entity;
    }
}
