package com.lpradar.pricing;

import java.math.BigDecimal;

/**
 * Decimal amounts of both pool tokens, each at its own token's decimal scale.
 */
public record TokenAmounts(BigDecimal amount0, BigDecimal amount1) {

    public static TokenAmounts zero(int decimals0, int decimals1) {
        return new TokenAmounts(BigDecimal.ZERO.setScale(decimals0), BigDecimal.ZERO.setScale(decimals1));
    }
}
