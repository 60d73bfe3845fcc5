package com.vaultledger.common;

/**
 * Reasons a ledger operation is rejected. Every code aborts the whole operation; none is retried internally.
 */
public enum LedgerErrorCode {
    UNAUTHORIZED,
    ASSET_NOT_REGISTERED,
    INVALID_PRICE,
    METADATA_UNAVAILABLE,
    NOTHING_TO_DEPOSIT,
    NOTHING_TO_WITHDRAW,
    INSUFFICIENT_BALANCE,
    WITHDRAW_LIMIT_EXCEEDED,
    CAPACITY_EXCEEDED,
    FAILED_TRANSFER,
    INVALID_DIRECT_TRANSFER,
    REENTRANT_CALL
}
