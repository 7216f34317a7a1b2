package com.lpradar.chain;

import java.math.BigInteger;

/**
 * Decoded V3 {@code Swap} event. Amounts are signed pool deltas (positive = into the pool).
 */
public record SwapLog(
        String poolAddress,
        BigInteger amount0,
        BigInteger amount1,
        BigInteger sqrtPriceX96,
        BigInteger liquidity,
        int tick,
        long blockNumber,
        long logIndex,
        String transactionHash
) {
}
