package com.vaultledger.api.dto;

import java.math.BigInteger;

public record ReceiptResponse(String userId, String assetId, String type, BigInteger amount, BigInteger balanceAfter) {
}
