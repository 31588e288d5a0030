package com.flagship.coin_economy.exception;

import lombok.Getter;

/**
 * A bot spend would exceed the treasury daily cap or the bot's wallet cap.
 * The treasury counters are left untouched when this is thrown.
 */
@Getter
public class CapExceededException extends EconomyException {

    public enum Cap {
        DAILY_SPEND,
        BOT_WALLET
    }

    private final Cap cap;
    private final long limit;
    private final long current;
    private final long requested;

    public CapExceededException(Cap cap, long limit, long current, long requested) {
        super(String.format("%s cap exceeded: limit=%d, current=%d, requested=%d", cap, limit, current, requested));
        this.cap = cap;
        this.limit = limit;
        this.current = current;
        this.requested = requested;
    }

    @Override
    public String getErrorCode() {
        return "CAP_EXCEEDED";
    }
}
