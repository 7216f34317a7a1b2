package com.lpradar.pricing;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LiquidityMathTest {

    private static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);
    private static final BigInteger L = new BigInteger("1000000000000000000");

    @Test
    void amounts_symmetricRangeAtParity_splitsEvenly() {
        TokenAmounts amounts = LiquidityMath.amounts(L, Q96, 0, -60, 60, 18, 18);

        assertThat(amounts.amount0()).isCloseTo(new BigDecimal("0.0029955"), within(new BigDecimal("0.000001")));
        assertThat(amounts.amount1()).isCloseTo(amounts.amount0(), within(new BigDecimal("0.0000001")));
    }

    @Test
    void amounts_belowRange_allToken0() {
        TokenAmounts amounts = LiquidityMath.amounts(L, Q96, -100, -60, 60, 18, 6);

        assertThat(amounts.amount0()).isPositive();
        assertThat(amounts.amount1()).isZero();
        assertThat(amounts.amount1().scale()).isEqualTo(6);
    }

    @Test
    void amounts_atUpperTick_allToken1() {
        TokenAmounts amounts = LiquidityMath.amounts(L, Q96, 60, -60, 60, 18, 18);

        assertThat(amounts.amount0()).isZero();
        assertThat(amounts.amount1()).isPositive();
    }

    @Test
    void amounts_zeroLiquidity_zeroAtTokenScale() {
        TokenAmounts amounts = LiquidityMath.amounts(BigInteger.ZERO, Q96, 0, -60, 60, 18, 6);

        assertThat(amounts).isEqualTo(TokenAmounts.zero(18, 6));
    }

    @Test
    void amounts_invertedRange_throws() {
        assertThatThrownBy(() -> LiquidityMath.amounts(L, Q96, 0, 60, 60, 18, 18))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toDecimal_appliesDecimals() {
        assertThat(LiquidityMath.toDecimal(BigInteger.valueOf(1_500_000L), 6)).isEqualByComparingTo("1.5");
        assertThat(LiquidityMath.toDecimal(null, 6)).isZero();
    }
}
