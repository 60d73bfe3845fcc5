package com.vaultledger.api.dto;

import java.math.BigInteger;

public record ValuationResponse(String assetId, BigInteger amount, BigInteger value, int commonDecimals) {
}
