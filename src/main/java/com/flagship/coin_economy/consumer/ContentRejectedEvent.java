package com.flagship.coin_economy.consumer;

import com.flagship.coin_economy.bot.TargetType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by moderation when content is taken down.
 */
@Value
public class ContentRejectedEvent {
    public static final String EVENT_TYPE = "ContentRejected";

    UUID eventId;
    String eventType;
    TargetType targetType;
    String targetId;
    String reason;
    Instant occurredAt;
}
