package com.flagship.coin_economy.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps economy failures and request validation errors to {@link ApiError} bodies.
 *
 * Business rejections (balance, caps, refunds) are 4xx and final for that key;
 * only {@link StoreUnavailableException} is marked retryable.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ApiError> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Insufficient balance: wallet={}, balance={}, required={}",
                e.getWalletId(), e.getBalance(), e.getRequired());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("walletId", e.getWalletId().toString());
        details.put("balance", String.valueOf(e.getBalance()));
        details.put("required", String.valueOf(e.getRequired()));
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, details);
    }

    @ExceptionHandler(CapExceededException.class)
    public ResponseEntity<ApiError> handleCapExceeded(CapExceededException e) {
        log.warn("Spend cap exceeded: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("cap", e.getCap().name());
        details.put("limit", String.valueOf(e.getLimit()));
        details.put("current", String.valueOf(e.getCurrent()));
        details.put("requested", String.valueOf(e.getRequested()));
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, details);
    }

    @ExceptionHandler(InvalidEntrySetException.class)
    public ResponseEntity<ApiError> handleInvalidEntrySet(InvalidEntrySetException e) {
        log.warn("Invalid entry set: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler(AlreadyRefundedException.class)
    public ResponseEntity<ApiError> handleAlreadyRefunded(AlreadyRefundedException e) {
        log.info("Refund rejected: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Ledger store unavailable: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ApiError> handleDuplicateKey(DuplicateKeyException e) {
        log.info("Duplicate resource: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "DUPLICATE_RESOURCE", "Resource already exists", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> fields.putIfAbsent(error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));
        log.warn("Validation failed: {}", fields);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "UNREADABLE_BODY", "Request body could not be parsed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, EconomyException e,
                                                    Map<String, String> details) {
        return respond(status, e.getErrorCode(), e.getMessage(), details);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message,
                                                    Map<String, String> details) {
        return ResponseEntity.status(status).body(ApiError.of(status, code, message, details));
    }
}
