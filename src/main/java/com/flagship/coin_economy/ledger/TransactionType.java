package com.flagship.coin_economy.ledger;

public enum TransactionType {
    PURCHASE,
    REWARD,
    BOT_SPEND,
    REFUND,
    EXPIRATION,
    TREASURY_REFILL,
    PLATFORM_FEE,
    ADJUSTMENT;

    /**
     * Types that move treasury money and are only posted by the treasury, which
     * keeps its counters and caps in step with them.
     */
    public boolean isTreasuryManaged() {
        return this == BOT_SPEND || this == REFUND || this == TREASURY_REFILL || this == PLATFORM_FEE;
    }
}
