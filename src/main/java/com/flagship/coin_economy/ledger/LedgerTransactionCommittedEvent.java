package com.flagship.coin_economy.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fact published to the ledger-events topic for every committed transaction.
 */
@Value
public class LedgerTransactionCommittedEvent {

    public static final String EVENT_TYPE = "LedgerTransactionCommitted";

    UUID eventId;
    String eventType;
    UUID transactionId;
    TransactionType transactionType;
    String idempotencyKey;
    List<Leg> legs;
    Instant occurredAt;

    public static LedgerTransactionCommittedEvent of(UUID transactionId, TransactionType type,
                                                     String idempotencyKey, List<LedgerEntry> entries) {
        return new LedgerTransactionCommittedEvent(
            UUID.randomUUID(),
            EVENT_TYPE,
            transactionId,
            type,
            idempotencyKey,
            entries.stream()
                .map(e -> new Leg(e.getWalletId(), e.getDirection(), e.getAmount(), e.getBalanceAfter()))
                .toList(),
            Instant.now()
        );
    }

    @Value
    public static class Leg {
        UUID walletId;
        EntryDirection direction;
        long amount;
        long balanceAfter;
    }
}
