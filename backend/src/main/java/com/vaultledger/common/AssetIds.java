package com.vaultledger.common;

import java.util.Locale;

/**
 * Asset identifiers are EVM contract addresses compared in lowercase. The zero address is reserved for the
 * native currency, which has no contract and always carries 18 decimals.
 */
public final class AssetIds {

    public static final String NATIVE = "0x0000000000000000000000000000000000000000";
    public static final int NATIVE_DECIMALS = 18;

    private AssetIds() {
    }

    /**
     * Lowercase, stripped form used as the storage key.
     *
     * @throws IllegalArgumentException if the id is null or blank
     */
    public static String normalize(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId must not be blank");
        }
        return assetId.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean isNative(String assetId) {
        return assetId != null && NATIVE.equals(assetId.strip().toLowerCase(Locale.ROOT));
    }
}
