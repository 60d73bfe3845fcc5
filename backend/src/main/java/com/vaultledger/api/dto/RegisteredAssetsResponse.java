package com.vaultledger.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Registry contents in registration order, with the registry bound.
 */
public record RegisteredAssetsResponse(int maxAssets, List<AssetEntry> assets) {

    public record AssetEntry(int position, String assetId, String priceSourceId, Instant registeredAt) {
    }
}
