package com.vaultledger.api.dto;

import java.math.BigInteger;

public record TotalValueResponse(BigInteger totalValue, BigInteger capacityLimit, int commonDecimals) {
}
