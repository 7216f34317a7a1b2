package com.lpradar.chain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwapLogDecoderTest {

    private static final String POOL = "0x7fcdc35463e3770c2fb992716cd070b63540b947";

    @Test
    void uniswapTopic_isWellKnownHash() {
        assertThat(SwapLogDecoder.UNISWAP_V3_SWAP_TOPIC)
                .isEqualTo("0xc42079f94a6350d7e6235f29174924f928cc2ac818eb64fed8004e115fbcca67");
        assertThat(SwapLogDecoder.PANCAKE_V3_SWAP_TOPIC)
                .startsWith("0x")
                .hasSize(66)
                .isNotEqualTo(SwapLogDecoder.UNISWAP_V3_SWAP_TOPIC);
    }

    @Test
    void decode_signedAmountsAndNegativeTick() {
        String data = "0x"
                + AbiCodec.encodeWord(BigInteger.valueOf(-5_000_000L))
                + AbiCodec.encodeWord(new BigInteger("1000000000000000000"))
                + AbiCodec.encodeWord(BigInteger.ONE.shiftLeft(96))
                + AbiCodec.encodeWord(BigInteger.valueOf(123_456L))
                + AbiCodec.encodeWord(-201_000);
        LogRecord log = new LogRecord(POOL, List.of(SwapLogDecoder.UNISWAP_V3_SWAP_TOPIC), data, 10L, 3L, "0xabc", false);

        SwapLog swap = SwapLogDecoder.decode(log);

        assertThat(swap.poolAddress()).isEqualTo(POOL);
        assertThat(swap.amount0()).isEqualTo(BigInteger.valueOf(-5_000_000L));
        assertThat(swap.amount1()).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(swap.sqrtPriceX96()).isEqualTo(BigInteger.ONE.shiftLeft(96));
        assertThat(swap.liquidity()).isEqualTo(BigInteger.valueOf(123_456L));
        assertThat(swap.tick()).isEqualTo(-201_000);
        assertThat(swap.blockNumber()).isEqualTo(10L);
        assertThat(swap.logIndex()).isEqualTo(3L);
        assertThat(swap.transactionHash()).isEqualTo("0xabc");
    }

    @Test
    void decode_pancakeExtraWordsIgnored() {
        String data = "0x"
                + AbiCodec.encodeWord(1L)
                + AbiCodec.encodeWord(-1L)
                + AbiCodec.encodeWord(BigInteger.ONE.shiftLeft(96))
                + AbiCodec.encodeWord(5L)
                + AbiCodec.encodeWord(7)
                + AbiCodec.encodeWord(11L)
                + AbiCodec.encodeWord(13L);
        LogRecord log = new LogRecord(POOL, List.of(SwapLogDecoder.PANCAKE_V3_SWAP_TOPIC), data, 1L, 0L, "0xdef", false);

        SwapLog swap = SwapLogDecoder.decode(log);

        assertThat(swap.tick()).isEqualTo(7);
        assertThat(swap.amount1()).isEqualTo(BigInteger.valueOf(-1L));
    }

    @Test
    void decode_shortData_throws() {
        LogRecord log = new LogRecord(POOL, List.of(), "0x" + AbiCodec.encodeWord(1L), 1L, 0L, "0x1", false);
        assertThatThrownBy(() -> SwapLogDecoder.decode(log))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 data words");
    }
}
