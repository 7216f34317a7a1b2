package com.lpradar.chain;

import java.util.List;

/**
 * Decodes V3 pool {@code Swap} logs. sender and recipient are indexed; the data section holds
 * amount0, amount1, sqrtPriceX96, liquidity and tick. PancakeSwap V3 appends two protocol-fee
 * words which are ignored.
 */
public final class SwapLogDecoder {

    public static final String UNISWAP_V3_SWAP_TOPIC =
            AbiCodec.eventTopic("Swap(address,address,int256,int256,uint160,uint128,int24)");
    public static final String PANCAKE_V3_SWAP_TOPIC =
            AbiCodec.eventTopic("Swap(address,address,int256,int256,uint160,uint128,int24,uint128,uint128)");

    private static final int SWAP_DATA_WORDS = 5;

    private SwapLogDecoder() {
    }

    /**
     * @throws IllegalArgumentException when the log data is too short to be a Swap
     */
    public static SwapLog decode(LogRecord log) {
        List<String> words = AbiCodec.words(log.data());
        if (words.size() < SWAP_DATA_WORDS) {
            throw new IllegalArgumentException("Swap log has " + words.size() + " data words, expected at least " + SWAP_DATA_WORDS);
        }
        return new SwapLog(
                log.address(),
                AbiCodec.decodeInt(words.get(0)),
                AbiCodec.decodeInt(words.get(1)),
                AbiCodec.decodeUint(words.get(2)),
                AbiCodec.decodeUint(words.get(3)),
                AbiCodec.decodeInt(words.get(4)).intValueExact(),
                log.blockNumber(),
                log.logIndex(),
                log.transactionHash()
        );
    }
}
