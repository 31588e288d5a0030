package com.flagship.coin_economy.exception;

/**
 * The ledger store could not be reached or timed out. Safe to retry with the
 * same idempotency key.
 */
public class StoreUnavailableException extends EconomyException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "STORE_UNAVAILABLE";
    }
}
