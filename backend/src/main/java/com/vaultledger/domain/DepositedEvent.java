package com.vaultledger.domain;

import java.math.BigInteger;

/**
 * Notification: a deposit was credited. Delivered to observers only after the operation commits.
 */
public record DepositedEvent(String userId, String assetId, BigInteger amount, BigInteger balanceAfter) {
}
