package com.prediction.market.amm.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.prediction.market.amm.controller.dto.ApiErrorResponse;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.ErrorKind;
import com.prediction.market.amm.result.InvariantViolationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps thrown exceptions to error bodies. Expected engine failures never
 * get here; {@link MarketController} maps those from their result values.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String INVARIANT_VIOLATION = "INVARIANT_VIOLATION";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> details = new HashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.badRequest().body(invalidRequest("Validation failed", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(invalidRequest("Malformed request body", null));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Invariant violation surfaced to client: marketId={}", ex.getMarketId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiErrorResponse.builder()
                .code(INVARIANT_VIOLATION)
                .message("Market halted after an internal consistency failure: " + ex.getMarketId())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiErrorResponse.builder()
                .code(INTERNAL_ERROR)
                .message("An unexpected error occurred")
                .build());
    }

    private static ApiErrorResponse invalidRequest(String message, Map<String, Object> details) {
        return ApiErrorResponse.builder()
                .code(ErrorCode.INVALID_REQUEST.name())
                .kind(ErrorKind.VALIDATION.name())
                .message(message)
                .details(details)
                .build();
    }
}
