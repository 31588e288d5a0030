package com.flagship.coin_economy.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.coin_economy.bot.BotActionRecorder;
import com.flagship.coin_economy.bot.TargetType;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContentModerationConsumerTest {

    private IdempotentEventProcessor eventProcessor;
    private BotActionRecorder actionRecorder;
    private ContentModerationConsumer consumer;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        actionRecorder = mock(BotActionRecorder.class);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        consumer = new ContentModerationConsumer(eventProcessor, actionRecorder, objectMapper);
    }

    @Test
    @DisplayName("Content rejection disqualifies the target's bot actions")
    void testRejectionDisqualifiesTarget() {
        UUID eventId = UUID.randomUUID();
        ContentRejectedEvent event = new ContentRejectedEvent(eventId, ContentRejectedEvent.EVENT_TYPE,
            TargetType.LISTING, "listing-7", "Counterfeit", Instant.now());
        when(eventProcessor.processEvent(eq(eventId), anyString(), anyString(), anyString(), anyString(), any()))
            .thenReturn(true);

        assertTrue(consumer.handle(event));

        ArgumentCaptor<Runnable> handler = ArgumentCaptor.forClass(Runnable.class);
        verify(eventProcessor).processEvent(eq(eventId), eq("ContentRejected"), eq("Content"),
            eq("LISTING:listing-7"), eq(ContentModerationConsumer.CONSUMER_GROUP), handler.capture());
        handler.getValue().run();
        verify(actionRecorder).disqualifyTarget(TargetType.LISTING, "listing-7", "Counterfeit");
    }

    @Test
    @DisplayName("Other moderation events are recorded as skipped")
    void testOtherEventSkipped() {
        UUID eventId = UUID.randomUUID();
        ContentRejectedEvent event = new ContentRejectedEvent(eventId, "ContentApproved",
            TargetType.THREAD, "thread-1", null, Instant.now());

        assertFalse(consumer.handle(event));

        verify(eventProcessor).skipEvent(eq(eventId), eq("ContentApproved"), anyString(), anyString(),
            eq(ContentModerationConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(actionRecorder);
    }

    @Test
    @DisplayName("Unreadable message is acknowledged and dropped")
    void testUnreadableMessage() {
        Acknowledgment ack = mock(Acknowledgment.class);

        consumer.consume(new ConsumerRecord<>("content-moderation", 0, 42L, "key", "{not json"), ack);

        verify(ack).acknowledge();
        verifyNoInteractions(eventProcessor, actionRecorder);
    }

    @Test
    @DisplayName("Readable message is handled then acknowledged")
    void testReadableMessage() {
        Acknowledgment ack = mock(Acknowledgment.class);
        UUID eventId = UUID.randomUUID();
        String json = String.format("""
            {"eventId": "%s", "eventType": "ContentRejected", "targetType": "THREAD",
             "targetId": "thread-3", "reason": "Spam", "occurredAt": "2026-03-01T10:00:00Z"}
            """, eventId);

        consumer.consume(new ConsumerRecord<>("content-moderation", 0, 7L, "key", json), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq("ContentRejected"), eq("Content"),
            eq("THREAD:thread-3"), eq(ContentModerationConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }
}
