package com.vaultledger.domain;

/**
 * Notification: actor granted (granted = true) or revoked a role for principal.
 */
public record RoleChangedEvent(String actor, String principal, LedgerRole role, boolean granted) {
}
