package com.flagship.coin_economy.treasury;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a platform-fee drain. {@code transactionId} is null when the
 * wallet held too little for the percentage to yield a whole coin.
 */
@Value
public class DrainResult {
    String userId;
    int percentage;
    long previousBalance;
    long drainedAmount;
    long newBalance;
    UUID transactionId;
    boolean duplicate;
}
