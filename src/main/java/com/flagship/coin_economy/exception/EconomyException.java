package com.flagship.coin_economy.exception;

/**
 * Base type for every failure the economy core reports to callers.
 *
 * Unchecked: synchronous callers receive the concrete subtype, the REST layer
 * maps it in {@link GlobalExceptionHandler}, and batch jobs record it per candidate.
 */
public abstract class EconomyException extends RuntimeException {

    protected EconomyException(String message) {
        super(message);
    }

    protected EconomyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code used in API error bodies and metric tags.
     */
    public abstract String getErrorCode();
}
