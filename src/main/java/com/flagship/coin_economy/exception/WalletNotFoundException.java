package com.flagship.coin_economy.exception;

import com.flagship.coin_economy.ledger.OwnerKind;

import java.util.UUID;

public class WalletNotFoundException extends ResourceNotFoundException {

    public WalletNotFoundException(UUID walletId) {
        super("Wallet", walletId);
    }

    public WalletNotFoundException(String ownerId, OwnerKind ownerKind) {
        super("Wallet", ownerKind + ":" + ownerId);
    }

    @Override
    public String getErrorCode() {
        return "WALLET_NOT_FOUND";
    }
}
