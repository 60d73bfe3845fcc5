package com.vaultledger.domain;

import java.math.BigInteger;

public record WithdrawLimitChangedEvent(String principal, BigInteger previousLimit, BigInteger newLimit) {
}
