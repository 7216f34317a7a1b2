package com.lpradar.chain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AbiCodecTest {

    private static final String HOLDER = "0x1111111111111111111111111111111111111111";

    @Test
    void selector_matchesKnownErc20Selectors() {
        assertThat(AbiCodec.selector("decimals()")).isEqualTo("0x313ce567");
        assertThat(AbiCodec.selector("balanceOf(address)")).isEqualTo("0x70a08231");
        assertThat(AbiCodec.selector("symbol()")).isEqualTo("0x95d89b41");
    }

    @Test
    void eventTopic_uniswapSwap() {
        assertThat(AbiCodec.eventTopic("Swap(address,address,int256,int256,uint160,uint128,int24)"))
                .isEqualTo("0xc42079f94a6350d7e6235f29174924f928cc2ac818eb64fed8004e115fbcca67");
    }

    @Test
    void encodeCall_padsAddressAndUint() {
        String data = AbiCodec.encodeCall("0x70a08231", "0xABCDEFabcdefABCDEFabcdefABCDEFabcdefABCD");
        assertThat(data).isEqualTo("0x70a08231" + "000000000000000000000000" + "abcdefabcdefabcdefabcdefabcdefabcdefabcd");

        String withUint = AbiCodec.encodeCall("0x99fbab88", BigInteger.valueOf(255));
        assertThat(withUint).endsWith("00ff").hasSize(10 + 64);
    }

    @Test
    void encodeWord_negativeUsesTwosComplement() {
        assertThat(AbiCodec.encodeWord(-1)).isEqualTo("f".repeat(64));
    }

    @Test
    void decodeInt_negativeTick() {
        String word = AbiCodec.encodeWord(-887272);
        assertThat(AbiCodec.decodeInt(word)).isEqualTo(BigInteger.valueOf(-887272));
        assertThat(AbiCodec.decodeUint(AbiCodec.encodeWord(887272))).isEqualTo(BigInteger.valueOf(887272));
    }

    @Test
    void decodeAddress_takesLow20Bytes() {
        String word = "000000000000000000000000" + HOLDER.substring(2);
        assertThat(AbiCodec.decodeAddress(word)).isEqualTo(HOLDER);
    }

    @Test
    void decodeString_dynamic() {
        // "USDC": offset 0x20, length 4, data
        String hex = "0x"
                + "0000000000000000000000000000000000000000000000000000000000000020"
                + "0000000000000000000000000000000000000000000000000000000000000004"
                + "5553444300000000000000000000000000000000000000000000000000000000";
        assertThat(AbiCodec.decodeString(hex)).isEqualTo("USDC");
    }

    @Test
    void decodeString_bytes32() {
        String hex = "0x4d4b520000000000000000000000000000000000000000000000000000000000";
        assertThat(AbiCodec.decodeString(hex)).isEqualTo("MKR");
    }

    @Test
    void decodeString_emptyResult_returnsEmpty() {
        assertThat(AbiCodec.decodeString("0x")).isEmpty();
        assertThat(AbiCodec.isEmptyResult("0x")).isTrue();
    }

    @Test
    void words_dropsTrailingPartialWord() {
        assertThat(AbiCodec.words("0x" + "0".repeat(64) + "12")).hasSize(1);
        assertThat(AbiCodec.words(null)).isEmpty();
    }

    @Test
    void hexQuantity_roundTrips() {
        assertThat(AbiCodec.toHexQuantity(255L)).isEqualTo("0xff");
        assertThat(AbiCodec.hexToLong("0xff")).isEqualTo(255L);
        assertThat(AbiCodec.hexToLong("0x")).isZero();
    }
}
