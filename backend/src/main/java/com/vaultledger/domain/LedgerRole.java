package com.vaultledger.domain;

/**
 * Flat two-role model. ADMINISTRATOR manages role assignments; OPERATOR mutates the asset registry and limits.
 * Neither implies the other.
 */
public enum LedgerRole {
    ADMINISTRATOR,
    OPERATOR
}
