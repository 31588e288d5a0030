package com.flagship.coin_economy.ledger;

/**
 * Who a wallet belongs to. TREASURY and SYSTEM wallets are seeded by migration.
 */
public enum OwnerKind {
    USER,
    BOT,
    TREASURY,
    SYSTEM
}
