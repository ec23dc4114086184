package com.chainexplorer.api.controller;

import com.chainexplorer.api.dto.ErrorBody;
import com.chainexplorer.ingestion.error.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps request and store failures to ErrorBody: 400 for invalid input, 503 while the store is unreachable.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = Optional.ofNullable(ex.getFieldError())
                .map(ApiExceptionHandler::describe)
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleInvalidRange(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_RANGE", ex.getMessage()));
    }

    @ExceptionHandler({ StoreUnavailableException.class, DataAccessException.class })
    public ResponseEntity<ErrorBody> handleStoreUnavailable(RuntimeException ex) {
        log.warn("Status read failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", "Chain store is unavailable"));
    }

    private static String describe(FieldError e) {
        return e.getField() + ": " + e.getDefaultMessage();
    }
}
