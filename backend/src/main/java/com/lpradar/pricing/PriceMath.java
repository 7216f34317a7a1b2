package com.lpradar.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Concentrated-liquidity price arithmetic. Prices are token1 per token0 adjusted by token decimals.
 * sqrt prices are handled as exact integers; tick powers use 40 significant digits.
 * <p>
 * In-range convention used everywhere: {@code tickLower <= tick < tickUpper}, the pool contract's own
 * definition of an active position.
 */
public final class PriceMath {

    public static final int DISPLAY_DECIMALS = 8;
    public static final int MIN_TICK = -887272;
    public static final int MAX_TICK = 887272;

    static final MathContext MC = new MathContext(40, RoundingMode.HALF_EVEN);

    private static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);
    private static final BigInteger Q192 = BigInteger.ONE.shiftLeft(192);
    private static final BigDecimal TICK_BASE = new BigDecimal("1.0001");
    private static final double LOG_TICK_BASE = Math.log(1.0001);

    private PriceMath() {
    }

    /**
     * (sqrtPriceX96² / 2^192) × 10^(decimals0 − decimals1), truncated to {@link #DISPLAY_DECIMALS} places.
     * A zero (or missing) sqrt price yields {@link Price#INFINITE}.
     */
    public static Price price(BigInteger sqrtPriceX96, int decimals0, int decimals1) {
        return price(sqrtPriceX96, decimals0, decimals1, DISPLAY_DECIMALS);
    }

    public static Price price(BigInteger sqrtPriceX96, int decimals0, int decimals1, int displayDecimals) {
        if (sqrtPriceX96 == null || sqrtPriceX96.signum() <= 0) {
            return Price.INFINITE;
        }
        int exponent = decimals0 - decimals1 + displayDecimals;
        BigInteger numerator = sqrtPriceX96.pow(2);
        BigInteger denominator = Q192;
        if (exponent >= 0) {
            numerator = numerator.multiply(BigInteger.TEN.pow(exponent));
        } else {
            denominator = denominator.multiply(BigInteger.TEN.pow(-exponent));
        }
        return Price.of(new BigDecimal(numerator.divide(denominator), displayDecimals));
    }

    /** Raw 1.0001^tick, not decimal adjusted. */
    public static BigDecimal priceAtTick(int tick) {
        checkTick(tick);
        return TICK_BASE.pow(tick, MC);
    }

    /** Human price at a tick: 1.0001^tick × 10^(decimals0 − decimals1), rounded to display decimals. */
    public static Price tickToPrice(int tick, int decimals0, int decimals1) {
        BigDecimal raw = priceAtTick(tick).scaleByPowerOfTen(decimals0 - decimals1);
        return Price.of(raw.setScale(DISPLAY_DECIMALS, RoundingMode.HALF_UP));
    }

    /**
     * Greatest tick whose raw price does not exceed {@code price} (the pool's own floor semantics),
     * clamped to the valid tick range.
     *
     * @throws IllegalArgumentException for a non-positive price
     */
    public static int tickAtPrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        double log = Math.log(price.doubleValue()) / LOG_TICK_BASE;
        int tick = (int) Math.max(MIN_TICK, Math.min(MAX_TICK, Math.floor(log)));
        while (tick > MIN_TICK && priceAtTick(tick).compareTo(price) > 0) {
            tick--;
        }
        while (tick < MAX_TICK && priceAtTick(tick + 1).compareTo(price) <= 0) {
            tick++;
        }
        return tick;
    }

    /** Human (decimal adjusted) price → tick, inverse of {@link #tickToPrice}. */
    public static int tickAtPrice(BigDecimal price, int decimals0, int decimals1) {
        return tickAtPrice(price.scaleByPowerOfTen(decimals1 - decimals0));
    }

    public static boolean inRange(int currentTick, int tickLower, int tickUpper) {
        return tickLower <= currentTick && currentTick < tickUpper;
    }

    /** sqrt(1.0001^tick). */
    public static BigDecimal sqrtRatioAtTick(int tick) {
        return priceAtTick(tick).sqrt(MC);
    }

    /** sqrtPriceX96 / 2^96. */
    public static BigDecimal sqrtRatio(BigInteger sqrtPriceX96) {
        return new BigDecimal(sqrtPriceX96).divide(new BigDecimal(Q96), MC);
    }

    private static void checkTick(int tick) {
        if (tick < MIN_TICK || tick > MAX_TICK) {
            throw new IllegalArgumentException("Tick out of range: " + tick);
        }
    }
}
