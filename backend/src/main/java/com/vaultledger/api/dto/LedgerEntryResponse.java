package com.vaultledger.api.dto;

import java.math.BigInteger;
import java.time.Instant;

public record LedgerEntryResponse(
        long sequence,
        String assetId,
        String type,
        BigInteger amount,
        BigInteger balanceAfter,
        Instant recordedAt
) {
}
