package com.flagship.coin_economy.ledger;

/**
 * Direction of a ledger entry from the wallet's point of view:
 * a credit increases the wallet balance, a debit decreases it.
 */
public enum EntryDirection {
    DEBIT,
    CREDIT;

    public long signed(long amount) {
        return this == CREDIT ? amount : -amount;
    }
}
