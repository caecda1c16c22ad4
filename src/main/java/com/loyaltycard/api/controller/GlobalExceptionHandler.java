package com.loyaltycard.api.controller;

import com.loyaltycard.common.exception.ErrorBody;
import com.loyaltycard.common.exception.ErrorKind;
import com.loyaltycard.common.exception.LoyaltyCardException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LoyaltyCardException.class)
    public ResponseEntity<Map<String, String>> handleLoyaltyCardException(LoyaltyCardException e) {
        if (e.getKind() == ErrorKind.INTERNAL) {
            log.error("Request failed", e);
        } else {
            log.warn("{}: {}", e.getKind(), e.getMessage());
        }
        return buildErrorResponse(e.getKind(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        String errors = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return buildErrorResponse(ErrorKind.INVALID_INPUT, "Validation failed: " + errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return buildErrorResponse(ErrorKind.INVALID_INPUT, "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return buildErrorResponse(ErrorKind.INVALID_INPUT, "Invalid value for " + e.getName());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        // framework errors such as unknown paths or unsupported methods carry their own status
        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            int status = errorResponse.getStatusCode().value();
            ErrorKind kind = status == 404 ? ErrorKind.NOT_FOUND : ErrorKind.INVALID_INPUT;
            Map<String, String> body = ErrorBody.of(kind, e.getMessage());
            body.put("status", String.valueOf(status));
            return ResponseEntity.status(status).body(body);
        }
        log.error("Unexpected error", e);
        return buildErrorResponse(ErrorKind.INTERNAL, "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getHttpStatus()).body(ErrorBody.of(kind, message));
    }
}
