package com.vaultledger.common;

import lombok.Getter;

/**
 * Thrown when a ledger, registry, valuation or permission rule rejects an operation.
 * API layer (LedgerExceptionHandler) maps the code to an HTTP status.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
