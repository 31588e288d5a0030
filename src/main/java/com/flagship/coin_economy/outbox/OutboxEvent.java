package com.flagship.coin_economy.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting to be published to Kafka.
 *
 * Written in the same database transaction as the ledger or job state change it
 * describes, then published by {@link OutboxPublisher}.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    String aggregateType;      // LedgerTransaction, Notification
    UUID aggregateId;          // transaction id or expiration record id
    String eventType;          // LedgerTransactionCommitted, CoinsExpired
    String payload;            // JSON
    String correlationId;      // request, job run or consumed record that caused it
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                                      String payload, String correlationId, Instant createdAt) {
        return OutboxEvent.builder()
            .id(UUID.randomUUID())
            .aggregateType(aggregateType)
            .aggregateId(aggregateId)
            .eventType(eventType)
            .payload(payload)
            .correlationId(correlationId)
            .createdAt(createdAt)
            .build();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
