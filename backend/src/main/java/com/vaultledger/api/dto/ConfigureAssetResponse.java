package com.vaultledger.api.dto;

public record ConfigureAssetResponse(String assetId, String priceSourceId, boolean newlyRegistered) {
}
