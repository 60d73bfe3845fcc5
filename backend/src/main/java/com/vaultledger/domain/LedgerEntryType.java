package com.vaultledger.domain;

public enum LedgerEntryType {
    DEPOSIT,
    WITHDRAWAL
}
