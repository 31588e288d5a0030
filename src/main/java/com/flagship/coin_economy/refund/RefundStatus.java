package com.flagship.coin_economy.refund;

/**
 * PENDING -> PROCESSING -> PROCESSED, or PROCESSING -> FAILED.
 * A transient failure puts a PROCESSING candidate back to PENDING.
 */
public enum RefundStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
