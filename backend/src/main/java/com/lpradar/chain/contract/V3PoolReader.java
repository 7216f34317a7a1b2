package com.lpradar.chain.contract;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ChainReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Reads of a V3 pool contract: immutables (tokens, fee, tick spacing) and live state (slot0, liquidity).
 */
@Component
@RequiredArgsConstructor
public class V3PoolReader {

    private static final String TOKEN0 = AbiCodec.selector("token0()");
    private static final String TOKEN1 = AbiCodec.selector("token1()");
    private static final String FEE = AbiCodec.selector("fee()");
    private static final String TICK_SPACING = AbiCodec.selector("tickSpacing()");
    private static final String SLOT0 = AbiCodec.selector("slot0()");
    private static final String LIQUIDITY = AbiCodec.selector("liquidity()");

    private final ChainReader chainReader;

    public PoolImmutables immutables(long chainId, String pool) {
        return new PoolImmutables(
                AbiCodec.decodeAddress(word(chainId, pool, TOKEN0, 0)),
                AbiCodec.decodeAddress(word(chainId, pool, TOKEN1, 0)),
                AbiCodec.decodeUint(word(chainId, pool, FEE, 0)).intValueExact(),
                AbiCodec.decodeInt(word(chainId, pool, TICK_SPACING, 0)).intValueExact()
        );
    }

    /** sqrtPriceX96 and tick are the first two slot0 words in both Uniswap and PancakeSwap layouts. */
    public Slot0 slot0(long chainId, String pool) {
        List<String> words = words(chainId, pool, SLOT0, 2);
        return new Slot0(
                AbiCodec.decodeUint(words.get(0)),
                AbiCodec.decodeInt(words.get(1)).intValueExact()
        );
    }

    public BigInteger liquidity(long chainId, String pool) {
        return AbiCodec.decodeUint(word(chainId, pool, LIQUIDITY, 0));
    }

    private String word(long chainId, String pool, String data, int index) {
        return words(chainId, pool, data, index + 1).get(index);
    }

    private List<String> words(long chainId, String pool, String data, int minWords) {
        List<String> words = AbiCodec.words(chainReader.ethCall(chainId, pool, data));
        if (words.size() < minWords) {
            throw new IllegalStateException("Pool " + pool + " returned no data for " + data);
        }
        return words;
    }

    public record PoolImmutables(String token0, String token1, int fee, int tickSpacing) {
    }

    public record Slot0(BigInteger sqrtPriceX96, int tick) {
    }
}
