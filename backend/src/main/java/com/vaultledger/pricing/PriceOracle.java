package com.vaultledger.pricing;

/**
 * External price feed. Implementations may throw any runtime exception when the feed cannot be read; the
 * valuation engine treats that as an invalid price.
 */
public interface PriceOracle {

    OraclePrice latestPrice(String priceSourceId);
}
