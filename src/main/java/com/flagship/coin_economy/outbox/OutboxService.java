package com.flagship.coin_economy.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coin_economy.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes events to the outbox inside the ledger or job transaction that produced
 * them: a committed transfer always has its event, a rolled back one never does.
 * {@link OutboxPublisher} moves them to Kafka afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves an event in the caller's transaction, tagged with the open correlation
     * id. Fails fast when there is no transaction.
     *
     * @param aggregateType selects the topic, e.g. "LedgerTransaction" or "Notification"
     * @param aggregateId   Kafka partition key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType,
            toJson(payload), CorrelationContext.current().orElse(null), Instant.now(clock));
        repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregate={}:{}", eventType, aggregateType, aggregateId);
        return event;
    }

    /**
     * Locks a batch of publishable events with SKIP LOCKED so concurrent
     * publishers never pick the same rows.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresentOrElse(
            entity -> entity.markPublished(Instant.now(clock)),
            () -> log.warn("Published event {} no longer in the outbox", eventId));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Outbox event {} failed, attempt {}: {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Outbox payload is not serializable: " + payload.getClass().getSimpleName(), e);
        }
    }
}
