package com.flagship.coin_economy.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AlreadyRefundedException extends EconomyException {

    private final UUID actionId;

    public AlreadyRefundedException(UUID actionId) {
        super("Bot action " + actionId + " has already been refunded");
        this.actionId = actionId;
    }

    @Override
    public String getErrorCode() {
        return "ALREADY_REFUNDED";
    }
}
