package com.flagship.coin_economy.bot;

/**
 * What a bot spent coins on.
 *
 * Only actions that buy or unlock content can be disqualified and refunded;
 * engagement actions (likes, follows, views, replies, referrals) are final.
 * Purchases are refunded automatically by default.
 */
public enum BotActionType {
    LIKE(false, false),
    FOLLOW(false, false),
    VIEW(false, false),
    REPLY(false, false),
    REFERRAL(false, false),
    PURCHASE(true, true),
    DOWNLOAD(true, false),
    UNLOCK(true, false);

    private final boolean refundable;
    private final boolean autoRefund;

    BotActionType(boolean refundable, boolean autoRefund) {
        this.refundable = refundable;
        this.autoRefund = autoRefund;
    }

    public boolean isRefundable() {
        return refundable;
    }

    public boolean isAutoRefund() {
        return autoRefund;
    }
}
