package com.lpradar.monitor;

import com.lpradar.pricing.Price;

import java.math.BigInteger;

/**
 * A swap as seen by one position: its range bounds as prices and whether the new tick is inside.
 */
public record PositionSwapEvent(
        SwapEvent swap,
        String positionId,
        BigInteger tokenId,
        int tickLower,
        int tickUpper,
        Price lowerPrice,
        Price upperPrice,
        boolean inRange
) {
}
