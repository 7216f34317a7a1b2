package com.lpradar.cache;

import java.math.BigDecimal;

/**
 * Token balances held by a pool and their sum in token1 units.
 */
public record PoolTvl(BigDecimal amount0, BigDecimal amount1, BigDecimal valueInToken1) {
}
