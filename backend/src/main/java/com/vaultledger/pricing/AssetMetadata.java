package com.vaultledger.pricing;

/**
 * Decimal precision of non-native assets. Never consulted for the native currency.
 */
public interface AssetMetadata {

    int decimals(String assetId);
}
