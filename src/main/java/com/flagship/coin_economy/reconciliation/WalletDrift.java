package com.flagship.coin_economy.reconciliation;

import com.flagship.coin_economy.ledger.OwnerKind;
import lombok.Value;

import java.util.UUID;

/**
 * A wallet whose cached balance differs from the sum of its entries.
 */
@Value
public class WalletDrift {
    UUID walletId;
    String ownerId;
    OwnerKind ownerKind;
    long cachedBalance;
    long derivedBalance;

    public long getDrift() {
        return Math.abs(cachedBalance - derivedBalance);
    }
}
