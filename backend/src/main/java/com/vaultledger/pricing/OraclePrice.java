package com.vaultledger.pricing;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Latest answer of a price source: answer scaled by 10^decimals, in common-denomination units per whole asset.
 * answer is signed as reported by the feed; the valuation engine rejects non-positive values.
 */
public record OraclePrice(BigInteger answer, int decimals, Instant updatedAt) {
}
