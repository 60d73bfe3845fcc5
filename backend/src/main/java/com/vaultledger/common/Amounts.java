package com.vaultledger.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between the integral base-unit amounts the engine computes with (BigInteger) and the
 * BigDecimal form stored as Decimal128.
 */
public final class Amounts {

    /** Decimal128 keeps at most 34 significant digits. */
    public static final int MAX_STORED_DIGITS = 34;

    private Amounts() {
    }

    public static BigInteger requireNonNegative(BigInteger amount, String name) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + amount);
        }
        return amount;
    }

    /**
     * @throws IllegalArgumentException if the amount has more digits than Decimal128 can hold exactly
     */
    public static BigDecimal toStored(BigInteger amount) {
        BigDecimal stored = new BigDecimal(amount);
        if (stored.precision() > MAX_STORED_DIGITS) {
            throw new IllegalArgumentException("Amount exceeds " + MAX_STORED_DIGITS + " digits: " + amount);
        }
        return stored;
    }

    /**
     * Stored value back to base units; null reads as zero.
     *
     * @throws ArithmeticException if the stored value has a fractional part
     */
    public static BigInteger fromStored(BigDecimal stored) {
        if (stored == null) {
            return BigInteger.ZERO;
        }
        return stored.toBigIntegerExact();
    }
}
