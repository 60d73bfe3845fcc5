package com.vaultledger.domain;

/**
 * Notification: an asset was registered, or its price source replaced (newlyRegistered = false).
 */
public record AssetConfiguredEvent(String principal, String assetId, String priceSourceId, boolean newlyRegistered) {
}
