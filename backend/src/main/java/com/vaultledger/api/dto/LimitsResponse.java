package com.vaultledger.api.dto;

import java.math.BigInteger;

/**
 * capacityLimit in common-denomination units (commonDecimals); withdrawLimit in asset base units.
 */
public record LimitsResponse(BigInteger capacityLimit, BigInteger withdrawLimit, int commonDecimals) {
}
