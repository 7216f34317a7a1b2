package com.lpradar.valuation;

import java.math.BigDecimal;

/**
 * Pending staking reward in reward token units.
 */
public record StakingReward(BigDecimal amount) {

    public static final StakingReward NONE = new StakingReward(BigDecimal.ZERO);

    public boolean isZero() {
        return amount.signum() == 0;
    }
}
