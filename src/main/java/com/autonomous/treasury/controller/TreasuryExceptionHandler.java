package com.autonomous.treasury.controller;

import com.autonomous.treasury.exception.BudgetNotFoundException;
import com.autonomous.treasury.exception.ContentionExceededException;
import com.autonomous.treasury.exception.InsufficientFundsException;
import com.autonomous.treasury.exception.OperationCancelledException;
import com.autonomous.treasury.exception.PolicyDenialException;
import com.autonomous.treasury.exception.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps "not allowed" (4xx, with the audited transaction id) apart from "try again" (503).
 */
@Slf4j
@RestControllerAdvice
public class TreasuryExceptionHandler {

    @ExceptionHandler(BudgetNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(BudgetNotFoundException e) {
        return denial(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientFunds(InsufficientFundsException e) {
        return denial(HttpStatus.PAYMENT_REQUIRED, e);
    }

    @ExceptionHandler(PolicyDenialException.class)
    public ResponseEntity<Map<String, Object>> handleDenial(PolicyDenialException e) {
        return denial(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(ContentionExceededException.class)
    public ResponseEntity<Map<String, Object>> handleContention(ContentionExceededException e) {
        Map<String, Object> body = body("contention", e.getMessage());
        if (e.getTransactionId() != null) {
            body.put("transactionId", e.getTransactionId());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).header("Retry-After", "1").body(body);
    }

    @ExceptionHandler(OperationCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(OperationCancelledException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("cancelled", e.getMessage()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(StoreException e) {
        log.error("Store failure", e);
        Map<String, Object> body = body("store_unavailable", e.getMessage());
        if (e.getTransactionId() != null) {
            body.put("transactionId", e.getTransactionId());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("invalid_request", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("conflict", e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> denial(HttpStatus status, PolicyDenialException e) {
        Map<String, Object> body = body(e.getReason().code(), e.getMessage());
        body.put("transactionId", e.getTransactionId());
        return ResponseEntity.status(status).body(body);
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
