package com.flagship.coin_economy.consumer;

import com.flagship.coin_economy.jobs.BatchSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The handler's writes and the processed-event row commit together. A handler
 * that fails permanently has its writes rolled back and the event recorded as
 * FAILED, so a poison message is not redelivered forever. A transient failure
 * is rethrown and nothing is recorded, so the broker redelivers.
 */
@Service
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IdempotentEventProcessor(ProcessedEventRepository repository,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * @return true if the handler ran and committed, false if the event was a
     *         duplicate or failed permanently
     */
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            logDuplicate(eventId, consumerGroup);
            return false;
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                handler.run();
                repository.save(ProcessedEventEntity.of(eventId, eventType, aggregateType, aggregateId,
                    consumerGroup, ProcessingResult.SUCCESS, null, Instant.now(clock)));
            });
            log.debug("Processed event {} for consumer group {}", eventId, consumerGroup);
            return true;

        } catch (DataIntegrityViolationException e) {
            if (isAlreadyProcessed(eventId, consumerGroup)) {
                log.info("Event {} was handled concurrently for consumer group {}, rolled back this attempt",
                        eventId, consumerGroup);
                return false;
            }
            recordFailure(eventId, eventType, aggregateType, aggregateId, consumerGroup, e);
            return false;

        } catch (RuntimeException e) {
            if (BatchSupport.isTransient(e)) {
                log.warn("Transient failure on event {}, leaving it for redelivery: {}", eventId, e.getMessage());
                throw e;
            }
            recordFailure(eventId, eventType, aggregateType, aggregateId, consumerGroup, e);
            return false;
        }
    }

    /**
     * Marks an event as not relevant to this consumer group.
     */
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> repository.save(ProcessedEventEntity.of(
                eventId, eventType, aggregateType, aggregateId, consumerGroup,
                ProcessingResult.SKIPPED, reason, Instant.now(clock))));
            log.debug("Skipped event {} for consumer group {}: {}", eventId, consumerGroup, reason);
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} recorded concurrently for consumer group {}", eventId, consumerGroup);
        }
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void logDuplicate(UUID eventId, String consumerGroup) {
        repository.findByEventIdAndConsumerGroup(eventId, consumerGroup).ifPresent(prior ->
            log.info("Event {} already {} for consumer group {} at {}, skipping",
                    eventId, prior.getProcessingResult(), consumerGroup, prior.getProcessedAt()));
    }

    private void recordFailure(UUID eventId, String eventType, String aggregateType, String aggregateId,
                               String consumerGroup, RuntimeException cause) {
        log.error("Event {} failed permanently for consumer group {}: {}",
                eventId, consumerGroup, cause.getMessage(), cause);
        transactionTemplate.executeWithoutResult(status -> repository.save(ProcessedEventEntity.of(
            eventId, eventType, aggregateType, aggregateId, consumerGroup,
            ProcessingResult.FAILED, cause.getMessage(), Instant.now(clock))));
    }
}
