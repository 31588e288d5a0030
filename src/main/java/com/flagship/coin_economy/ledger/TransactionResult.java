package com.flagship.coin_economy.ledger;

import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of {@link LedgerService#commit}.
 *
 * For a replayed idempotency key {@code duplicate} is true and the balances are
 * the ones recorded when the original transaction committed.
 */
@Value
public class TransactionResult {
    UUID transactionId;
    TransactionType type;
    String idempotencyKey;
    Map<UUID, Long> resultingBalances;
    boolean duplicate;

    public long balanceOf(UUID walletId) {
        Long balance = resultingBalances.get(walletId);
        if (balance == null) {
            throw new IllegalArgumentException("Wallet " + walletId + " is not part of transaction " + transactionId);
        }
        return balance;
    }
}
