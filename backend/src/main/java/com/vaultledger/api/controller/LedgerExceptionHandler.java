package com.vaultledger.api.controller;

import com.vaultledger.api.dto.ErrorBody;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ledger rejections to HTTP statuses. Every rejection is a whole-operation abort, so the body only
 * carries the code and message.
 */
@RestControllerAdvice
@Slf4j
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        log.debug("Ledger operation rejected: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    static HttpStatus statusOf(LedgerErrorCode code) {
        return switch (code) {
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case ASSET_NOT_REGISTERED -> HttpStatus.NOT_FOUND;
            case NOTHING_TO_DEPOSIT, NOTHING_TO_WITHDRAW -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_BALANCE, REENTRANT_CALL -> HttpStatus.CONFLICT;
            case WITHDRAW_LIMIT_EXCEEDED, CAPACITY_EXCEEDED, INVALID_PRICE, INVALID_DIRECT_TRANSFER ->
                    HttpStatus.UNPROCESSABLE_ENTITY;
            case FAILED_TRANSFER -> HttpStatus.BAD_GATEWAY;
            case METADATA_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
