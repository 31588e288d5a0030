package com.flagship.coin_economy.ledger;

import java.util.UUID;

/**
 * Wallet that absorbs the balancing leg of a one-sided transaction.
 */
public enum Counterparty {
    TREASURY(SystemWallets.TREASURY_WALLET_ID),
    VOID(SystemWallets.VOID_WALLET_ID);

    private final UUID walletId;

    Counterparty(UUID walletId) {
        this.walletId = walletId;
    }

    public UUID walletId() {
        return walletId;
    }
}
