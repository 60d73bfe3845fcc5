package com.vaultledger.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Valuation settings. Documented in application.yml under vaultledger.valuation.
 */
@ConfigurationProperties(prefix = "vaultledger.valuation")
@Getter
@Setter
public class ValuationProperties {

    /** Decimals of the common denomination (6 = USD with micro-dollar resolution). */
    private int commonDecimals = 6;

    /** Feed answers older than this are rejected as invalid. Zero disables the check. */
    private Duration maxPriceAge = Duration.ofHours(1);

    /** assetId (lowercase) -> decimals, consulted before the on-chain metadata source. */
    private Map<String, Integer> decimalsOverrides = new HashMap<>();
}
