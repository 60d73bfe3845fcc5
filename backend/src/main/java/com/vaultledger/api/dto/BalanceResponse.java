package com.vaultledger.api.dto;

import java.math.BigInteger;

public record BalanceResponse(String userId, String assetId, BigInteger amount) {
}
