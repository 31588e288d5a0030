package com.flagship.coin_economy.exception;

/**
 * Notification could not be enqueued. Never reverses the ledger effect that
 * triggered it.
 */
public class NotificationFailedException extends EconomyException {

    public NotificationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "NOTIFICATION_FAILED";
    }
}
