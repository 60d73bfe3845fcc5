package com.vaultledger.chain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbiWordsTest {

    static String word(BigInteger value) {
        BigInteger unsigned = value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(256)) : value;
        String hex = unsigned.toString(16);
        return "0".repeat(64 - hex.length()) + hex;
    }

    @Test
    void uintWord_readsWordAtIndex() {
        String data = "0x" + word(BigInteger.valueOf(7)) + word(BigInteger.valueOf(200_000_000_000L));
        assertThat(AbiWords.wordCount(data)).isEqualTo(2);
        assertThat(AbiWords.uintWord(data, 0)).isEqualTo(7);
        assertThat(AbiWords.uintWord(data, 1)).isEqualTo(200_000_000_000L);
    }

    @Test
    void intWord_decodesNegativeTwosComplement() {
        String data = "0x" + word(BigInteger.valueOf(-5));
        assertThat(AbiWords.intWord(data, 0)).isEqualTo(-5);
        assertThat(AbiWords.uintWord(data, 0)).isEqualTo(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.valueOf(5)));
    }

    @Test
    void uintWord_missingWord_throwsRpcException() {
        assertThatThrownBy(() -> AbiWords.uintWord("0x" + word(BigInteger.ONE), 1))
                .isInstanceOf(RpcException.class);
        assertThat(AbiWords.wordCount(null)).isZero();
    }
}
