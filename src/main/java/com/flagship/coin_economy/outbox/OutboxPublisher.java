package com.flagship.coin_economy.outbox;

import com.flagship.coin_economy.observability.CorrelationContext;
import com.flagship.coin_economy.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * Ledger events go to {@code kafka.topic.ledger-events}, expiry notices to
 * {@code kafka.topic.notifications}. The aggregate id is the record key, so all
 * events of one transaction or expiration land on one partition in write order.
 * Each record carries the event id, the event type and the correlation id of
 * the request or job run that wrote it as headers.
 *
 * Sends are synchronous. An event that fails {@code max-retries} times stays in
 * the table as a dead letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String LEDGER_AGGREGATE = "LedgerTransaction";
    static final String NOTIFICATION_AGGREGATE = "Notification";

    static final String EVENT_ID_HEADER = "X-Event-ID";
    static final String EVENT_TYPE_HEADER = "X-Event-Type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.notifications:coin-notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not poll the outbox", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        log.debug("Publishing {} outbox events", events.size());
        for (OutboxEvent event : events) {
            try (CorrelationContext.Scope ignored = CorrelationContext.begin(event.getCorrelationId())) {
                publish(event);
            }
        }
    }

    private void publish(OutboxEvent event) {
        ProducerRecord<String, String> record = toRecord(event);
        try {
            RecordMetadata metadata = kafkaTemplate.send(record)
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                    metadata.topic(), metadata.partition(), metadata.offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getMessage());
        } catch (TimeoutException e) {
            recordFailure(event, "No broker acknowledgement within " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String reason) {
        log.error("Failed to publish {} {} for {}:{}: {}", event.getEventType(), event.getId(),
                event.getAggregateType(), event.getAggregateId(), reason);
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox event {} is now a dead letter after {} attempts", event.getId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            topicFor(event), event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_ID_HEADER, bytes(event.getId().toString()));
        record.headers().add(EVENT_TYPE_HEADER, bytes(event.getEventType()));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER, bytes(event.getCorrelationId()));
        }
        return record;
    }

    String topicFor(OutboxEvent event) {
        return NOTIFICATION_AGGREGATE.equals(event.getAggregateType()) ? notificationsTopic : ledgerEventsTopic;
    }

    /**
     * Publishes one batch now, outside the polling schedule.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
