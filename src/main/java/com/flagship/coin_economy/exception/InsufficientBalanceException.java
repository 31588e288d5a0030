package com.flagship.coin_economy.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A debit would take a wallet below zero and neither the transaction nor the
 * wallet allows overdraft.
 */
@Getter
public class InsufficientBalanceException extends EconomyException {

    private final UUID walletId;
    private final long balance;
    private final long required;

    public InsufficientBalanceException(UUID walletId, long balance, long required) {
        super(String.format("Wallet %s has balance %d but %d is required", walletId, balance, required));
        this.walletId = walletId;
        this.balance = balance;
        this.required = required;
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_BALANCE";
    }
}
