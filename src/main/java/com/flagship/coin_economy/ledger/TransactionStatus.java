package com.flagship.coin_economy.ledger;

/**
 * COMMITTED transactions own their idempotency key and carry entries.
 * FAILED rows are audit records of rejected attempts and carry none.
 */
public enum TransactionStatus {
    COMMITTED,
    FAILED
}
