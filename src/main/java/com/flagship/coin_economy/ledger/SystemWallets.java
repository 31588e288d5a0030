package com.flagship.coin_economy.ledger;

import java.util.UUID;

/**
 * Fixed ids of the wallets seeded by V1/V2 migrations.
 */
public final class SystemWallets {

    public static final UUID TREASURY_WALLET_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    /**
     * Mint/burn sink. Overdraft-enabled, so its balance is minus the coin supply.
     */
    public static final UUID VOID_WALLET_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");

    private SystemWallets() {
    }
}
