package com.flagship.coin_economy.exception;

import com.flagship.coin_economy.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every API failure.
 *
 * {@code retryable} tells the client whether resending the same request with the
 * same {@code Idempotency-Key} can succeed.
 */
@Value
@Builder
public class ApiError {
    int status;
    String error;
    String code;
    String message;
    boolean retryable;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;

    static ApiError of(HttpStatus status, String code, String message, Map<String, String> details) {
        return ApiError.builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .retryable(status == HttpStatus.SERVICE_UNAVAILABLE)
            .details(details)
            .correlationId(CorrelationContext.currentOrNew())
            .timestamp(Instant.now())
            .build();
    }
}
