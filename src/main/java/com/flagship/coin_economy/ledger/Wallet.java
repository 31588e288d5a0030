package com.flagship.coin_economy.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a wallet.
 *
 * The balance is a cache of the wallet's settled entries (credits minus debits),
 * written only by {@link LedgerService} together with the entries.
 */
@Value
@Builder(toBuilder = true)
public class Wallet {
    UUID id;
    String ownerId;
    OwnerKind ownerKind;
    long balance;
    long lifetimeEarned;
    long lifetimeSpent;
    Long spendCap;              // bots only, null means the treasury-wide bot cap applies
    boolean overdraftAllowed;
    long version;
    Instant createdAt;
    Instant updatedAt;

    public boolean isSystemWallet() {
        return ownerKind == OwnerKind.TREASURY || ownerKind == OwnerKind.SYSTEM;
    }
}
