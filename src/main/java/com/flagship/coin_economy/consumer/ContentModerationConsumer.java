package com.flagship.coin_economy.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coin_economy.bot.BotActionRecorder;
import com.flagship.coin_economy.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Disqualifies bot spends on content that moderation rejected.
 *
 * Offsets are acknowledged only after the event is handled or deliberately
 * skipped; redelivered events are deduplicated by {@link IdempotentEventProcessor}.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ContentModerationConsumer {

    static final String CONSUMER_GROUP = "bot-refund-moderation";
    private static final String AGGREGATE_TYPE = "Content";

    private final IdempotentEventProcessor eventProcessor;
    private final BotActionRecorder actionRecorder;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.content-moderation:content-moderation}",
        groupId = "${spring.kafka.consumer.group-id:coin-economy-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        try (CorrelationContext.Scope ignored = CorrelationContext.begin(correlationIdOf(record))) {
            log.debug("Received moderation event: partition={}, offset={}, key={}",
                    record.partition(), record.offset(), record.key());

            ContentRejectedEvent event = parse(record.value());
            if (event == null || event.getEventId() == null) {
                log.warn("Unreadable moderation event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            handle(event);
            ack.acknowledge();
        }
    }

    /**
     * @return true if the event disqualified the target's bot actions
     */
    boolean handle(ContentRejectedEvent event) {
        String aggregateId = event.getTargetType() + ":" + event.getTargetId();

        if (!ContentRejectedEvent.EVENT_TYPE.equals(event.getEventType())
                || event.getTargetType() == null || event.getTargetId() == null) {
            eventProcessor.skipEvent(event.getEventId(), String.valueOf(event.getEventType()),
                AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "Not a content rejection");
            return false;
        }

        String reason = event.getReason() != null ? event.getReason() : "Content rejected by moderation";
        boolean processed = eventProcessor.processEvent(
            event.getEventId(), event.getEventType(),
            AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP,
            () -> actionRecorder.disqualifyTarget(event.getTargetType(), event.getTargetId(), reason)
        );
        if (processed) {
            log.info("Content rejection handled: target={}, eventId={}", aggregateId, event.getEventId());
        }
        return processed;
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    private ContentRejectedEvent parse(String json) {
        try {
            return objectMapper.readValue(json, ContentRejectedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse moderation event: {}", e.getMessage());
            return null;
        }
    }
}
