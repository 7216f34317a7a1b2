package com.lpradar.valuation;

import com.lpradar.pricing.Price;

import java.math.BigDecimal;

/**
 * Fees accrued by a position and not yet collected, each at its token's decimals, with their
 * value in token1 (token1 assumed to be the unit of account) and any pending staking reward.
 */
public record UnclaimedFees(
        String token0Symbol,
        String token1Symbol,
        BigDecimal amount0,
        BigDecimal amount1,
        BigDecimal value0,
        BigDecimal value1,
        BigDecimal totalValue,
        Price currentPrice,
        StakingReward reward
) {
}
