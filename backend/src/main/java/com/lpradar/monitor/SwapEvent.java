package com.lpradar.monitor;

import com.lpradar.pricing.Price;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * One observed swap. {@code volume} is the absolute traded amount of token1, or of token0 when
 * token1 did not move.
 */
public record SwapEvent(
        String poolId,
        String pairLabel,
        Price price,
        int tick,
        BigDecimal volume,
        String volumeSymbol,
        BigInteger liquidity,
        long blockNumber,
        String transactionHash
) {
}
