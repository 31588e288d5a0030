package com.flagship.coin_economy.exception;

/**
 * Malformed transaction: no entries, a non-positive amount, unbalanced legs
 * without a counterparty, a missing type or idempotency key, or a treasury or
 * bot leg its transaction type does not permit.
 */
public class InvalidEntrySetException extends EconomyException {

    public InvalidEntrySetException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_ENTRY_SET";
    }
}
