package com.vaultledger.domain;

import java.math.BigInteger;

public record CapacityLimitChangedEvent(String principal, BigInteger previousLimit, BigInteger newLimit) {
}
