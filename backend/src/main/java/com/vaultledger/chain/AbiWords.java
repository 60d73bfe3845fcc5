package com.vaultledger.chain;

import java.math.BigInteger;

/**
 * Decoding of static ABI return data: a 0x-prefixed hex string made of 32-byte words.
 */
public final class AbiWords {

    private static final int WORD_HEX_LENGTH = 64;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger TWO_255 = BigInteger.ONE.shiftLeft(255);

    private AbiWords() {
    }

    public static int wordCount(String hex) {
        return strip(hex).length() / WORD_HEX_LENGTH;
    }

    /**
     * Word at the zero-based index read as uint256.
     *
     * @throws RpcException if the data is shorter than index + 1 words
     */
    public static BigInteger uintWord(String hex, int index) {
        String raw = strip(hex);
        int start = index * WORD_HEX_LENGTH;
        if (index < 0 || raw.length() < start + WORD_HEX_LENGTH) {
            throw new RpcException("ABI data has no word " + index + ": " + hex);
        }
        try {
            return new BigInteger(raw.substring(start, start + WORD_HEX_LENGTH), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("ABI word " + index + " is not hex: " + hex, e);
        }
    }

    /**
     * Word at the zero-based index read as two's-complement int256.
     */
    public static BigInteger intWord(String hex, int index) {
        BigInteger unsigned = uintWord(hex, index);
        return unsigned.compareTo(TWO_255) >= 0 ? unsigned.subtract(TWO_256) : unsigned;
    }

    private static String strip(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
