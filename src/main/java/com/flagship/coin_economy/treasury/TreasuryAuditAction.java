package com.flagship.coin_economy.treasury;

public enum TreasuryAuditAction {
    TREASURY_REFILL,
    WALLET_DRAIN
}
