package com.vaultledger.domain;

import java.math.BigInteger;

/**
 * Notification: a withdrawal was debited and paid out.
 */
public record WithdrewEvent(String userId, String assetId, BigInteger amount, BigInteger balanceAfter) {
}
