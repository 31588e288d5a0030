package com.flagship.coin_economy.expiration;

public enum ExpirationStatus {
    PENDING,
    PROCESSED,
    CANCELLED
}
