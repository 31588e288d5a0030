package com.flagship.coin_economy.consumer;

public enum ProcessingResult {
    SUCCESS,
    SKIPPED,    // not relevant to this consumer group
    FAILED      // permanent failure, never redelivered to the handler
}
