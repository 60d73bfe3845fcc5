package com.vaultledger.ledger;

import com.vaultledger.domain.LedgerEntryType;

import java.math.BigInteger;

public record LedgerReceipt(String userId, String assetId, BigInteger amount, BigInteger balanceAfter,
                            LedgerEntryType type) {
}
