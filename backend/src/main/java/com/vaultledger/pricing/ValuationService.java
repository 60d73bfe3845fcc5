package com.vaultledger.pricing;

import com.vaultledger.common.Amounts;
import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.pricing.config.ValuationProperties;
import com.vaultledger.registry.AssetRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Mark-to-market valuation of (asset, amount) in the common denomination, using the asset's registered price
 * source and its decimal precision. Read-only; safe to call repeatedly within one aggregation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValuationService {

    private static final int MAX_DECIMALS = 255;

    private final AssetRegistryService assetRegistryService;
    private final PriceOracle priceOracle;
    private final AssetMetadata assetMetadata;
    private final ValuationProperties valuationProperties;

    /**
     * Value of amount base units of assetId, truncated to whole common-denomination units.
     *
     * @throws LedgerException ASSET_NOT_REGISTERED, INVALID_PRICE (non-positive, stale or unreadable feed),
     *                         METADATA_UNAVAILABLE (asset decimals unknown)
     */
    public BigInteger valueOf(String assetId, BigInteger amount) {
        Amounts.requireNonNegative(amount, "amount");
        String asset = AssetIds.normalize(assetId);
        String priceSourceId = assetRegistryService.lookup(asset);
        OraclePrice price = latestPrice(asset, priceSourceId);
        int assetDecimals = decimalsOf(asset);
        return normalize(amount, price.answer(), price.decimals(), assetDecimals, commonDecimals());
    }

    public int commonDecimals() {
        return valuationProperties.getCommonDecimals();
    }

    /**
     * amount * price * 10^commonDecimals / 10^(assetDecimals + priceDecimals). Multiplication happens first in
     * arbitrary precision, so only the final division truncates.
     */
    static BigInteger normalize(BigInteger amount, BigInteger price, int priceDecimals,
                                int assetDecimals, int commonDecimals) {
        BigInteger numerator = amount.multiply(price).multiply(BigInteger.TEN.pow(commonDecimals));
        return numerator.divide(BigInteger.TEN.pow(assetDecimals + priceDecimals));
    }

    private OraclePrice latestPrice(String assetId, String priceSourceId) {
        OraclePrice price;
        try {
            price = priceOracle.latestPrice(priceSourceId);
        } catch (RuntimeException e) {
            log.warn("Price source {} for {} unreadable: {}", priceSourceId, assetId, e.getMessage());
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE,
                    "Price source " + priceSourceId + " unavailable for " + assetId, e);
        }
        if (price == null || price.answer() == null || price.answer().signum() <= 0) {
            log.warn("Price source {} for {} returned non-positive price {}", priceSourceId, assetId,
                    price != null ? price.answer() : null);
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE,
                    "Price source " + priceSourceId + " returned a non-positive price for " + assetId);
        }
        if (price.decimals() < 0 || price.decimals() > MAX_DECIMALS) {
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE,
                    "Price source " + priceSourceId + " reported invalid decimals " + price.decimals());
        }
        Duration maxAge = valuationProperties.getMaxPriceAge();
        if (maxAge != null && !maxAge.isZero() && !maxAge.isNegative()) {
            if (price.updatedAt() == null || price.updatedAt().isBefore(Instant.now().minus(maxAge))) {
                log.warn("Price source {} for {} is stale (updatedAt {})", priceSourceId, assetId, price.updatedAt());
                throw new LedgerException(LedgerErrorCode.INVALID_PRICE,
                        "Price source " + priceSourceId + " is stale for " + assetId);
            }
        }
        return price;
    }

    private int decimalsOf(String assetId) {
        if (AssetIds.isNative(assetId)) {
            return AssetIds.NATIVE_DECIMALS;
        }
        Integer override = valuationProperties.getDecimalsOverrides().get(assetId.toLowerCase(Locale.ROOT));
        if (override != null) {
            return override;
        }
        int decimals;
        try {
            decimals = assetMetadata.decimals(assetId);
        } catch (RuntimeException e) {
            log.warn("Decimals of {} unavailable: {}", assetId, e.getMessage());
            throw new LedgerException(LedgerErrorCode.METADATA_UNAVAILABLE,
                    "Decimals unavailable for " + assetId, e);
        }
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new LedgerException(LedgerErrorCode.METADATA_UNAVAILABLE,
                    "Asset " + assetId + " reported invalid decimals " + decimals);
        }
        return decimals;
    }
}
