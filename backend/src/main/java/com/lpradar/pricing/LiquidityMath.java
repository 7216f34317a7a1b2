package com.lpradar.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Token amounts backing a liquidity range, following the V3 formulas:
 * below range everything is token0, at or above the upper tick everything is token1,
 * otherwise the split is taken at the pool's current sqrt price.
 */
public final class LiquidityMath {

    private LiquidityMath() {
    }

    /**
     * @param liquidity    position liquidity (raw uint128)
     * @param sqrtPriceX96 pool sqrt price
     * @param currentTick  pool tick (selects the branch, see {@link PriceMath#inRange})
     * @return raw amounts rounded down, shifted by each token's decimals
     */
    public static TokenAmounts amounts(BigInteger liquidity, BigInteger sqrtPriceX96, int currentTick,
                                       int tickLower, int tickUpper, int decimals0, int decimals1) {
        if (tickLower >= tickUpper) {
            throw new IllegalArgumentException("tickLower must be below tickUpper: " + tickLower + " >= " + tickUpper);
        }
        if (liquidity == null || liquidity.signum() == 0) {
            return TokenAmounts.zero(decimals0, decimals1);
        }
        BigDecimal l = new BigDecimal(liquidity);
        BigDecimal sqrtLower = PriceMath.sqrtRatioAtTick(tickLower);
        BigDecimal sqrtUpper = PriceMath.sqrtRatioAtTick(tickUpper);

        BigDecimal raw0;
        BigDecimal raw1;
        if (currentTick < tickLower) {
            raw0 = amount0Delta(l, sqrtLower, sqrtUpper);
            raw1 = BigDecimal.ZERO;
        } else if (currentTick < tickUpper) {
            BigDecimal sqrtCurrent = PriceMath.sqrtRatio(sqrtPriceX96);
            raw0 = amount0Delta(l, sqrtCurrent, sqrtUpper);
            raw1 = amount1Delta(l, sqrtLower, sqrtCurrent);
        } else {
            raw0 = BigDecimal.ZERO;
            raw1 = amount1Delta(l, sqrtLower, sqrtUpper);
        }
        return new TokenAmounts(shift(raw0, decimals0), shift(raw1, decimals1));
    }

    /** L × (sb − sa) / (sa × sb). */
    private static BigDecimal amount0Delta(BigDecimal liquidity, BigDecimal sqrtA, BigDecimal sqrtB) {
        if (sqrtB.compareTo(sqrtA) <= 0) {
            return BigDecimal.ZERO;
        }
        return liquidity.multiply(sqrtB.subtract(sqrtA), PriceMath.MC)
                .divide(sqrtA.multiply(sqrtB, PriceMath.MC), PriceMath.MC);
    }

    /** L × (sb − sa). */
    private static BigDecimal amount1Delta(BigDecimal liquidity, BigDecimal sqrtA, BigDecimal sqrtB) {
        if (sqrtB.compareTo(sqrtA) <= 0) {
            return BigDecimal.ZERO;
        }
        return liquidity.multiply(sqrtB.subtract(sqrtA), PriceMath.MC);
    }

    private static BigDecimal shift(BigDecimal raw, int decimals) {
        return raw.setScale(0, RoundingMode.DOWN).movePointLeft(decimals).setScale(decimals, RoundingMode.DOWN);
    }

    /** Raw integer token amount → decimal at the token's scale. */
    public static BigDecimal toDecimal(BigInteger raw, int decimals) {
        if (raw == null) {
            return BigDecimal.ZERO.setScale(decimals);
        }
        return new BigDecimal(raw, decimals);
    }
}
