package com.flagship.coin_economy.notification;

/**
 * Hands user notifications to the delivery system.
 */
public interface NotificationGateway {

    /**
     * Enqueues a coin expiration notice. Returning normally means the notice
     * was accepted for delivery, not that it was delivered.
     */
    void sendCoinExpiration(CoinExpirationNotice notice);
}
