package com.flagship.coin_economy.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A single posted leg. Immutable once written (enforced by a database trigger).
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID walletId;
    EntryDirection direction;
    long amount;
    long balanceBefore;
    long balanceAfter;
    String memo;
    Long sequenceNumber;        // assigned by the database
    Instant createdAt;
}
