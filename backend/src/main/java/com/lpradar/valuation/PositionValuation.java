package com.lpradar.valuation;

import com.lpradar.cache.PoolCache;
import com.lpradar.chain.RpcException;
import com.lpradar.chain.config.ChainProperties;
import com.lpradar.chain.contract.PositionManagerReader;
import com.lpradar.chain.contract.StakerReader;
import com.lpradar.common.CachedCall;
import com.lpradar.config.CaffeineConfig;
import com.lpradar.domain.Pool;
import com.lpradar.domain.Position;
import com.lpradar.domain.Token;
import com.lpradar.pricing.LiquidityMath;
import com.lpradar.pricing.Price;
import com.lpradar.pricing.TokenAmounts;
import com.lpradar.valuation.config.ValuationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Amounts, value, uncollected fees and staking reward of a resolved position (pool and tokens attached).
 * Values are in token1 units; token1 is taken as the stable unit of account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionValuation {

    private final PoolCache poolCache;
    private final PositionManagerReader positionManagerReader;
    private final StakerReader stakerReader;
    private final ChainProperties chainProperties;
    private final ValuationProperties valuationProperties;
    private final CacheManager cacheManager;

    public TokenAmounts tokenAmounts(Position position) {
        Pool pool = position.getPool();
        Token token0 = pool.getToken0();
        Token token1 = pool.getToken1();
        if (position.isClosed() || pool.getSqrtPriceX96() == null || pool.getTick() == null) {
            return TokenAmounts.zero(token0.getDecimals(), token1.getDecimals());
        }
        return LiquidityMath.amounts(position.getLiquidity(), pool.getSqrtPriceX96(), pool.getTick(),
                position.getTickLower(), position.getTickUpper(), token0.getDecimals(), token1.getDecimals());
    }

    /**
     * amount0 × price + amount1. With a degenerate (infinite) price only amount1 is counted.
     */
    public BigDecimal combinedValue(Position position) {
        TokenAmounts amounts = tokenAmounts(position);
        Price price = poolCache.price(position.getPool());
        return valueInToken1(amounts.amount0(), amounts.amount1(), price, position.getPool().getToken1().getDecimals());
    }

    /**
     * Simulates collect with maximal amounts from the NFT holder: the owner, or the staker contract while
     * the position is staked. Closed positions report zero without a call.
     *
     * @throws FeeSimulationException when the simulated call fails
     */
    public UnclaimedFees unclaimedFees(Position position) {
        Pool pool = position.getPool();
        Token token0 = pool.getToken0();
        Token token1 = pool.getToken1();
        Price price = poolCache.price(pool);
        if (position.isClosed()) {
            BigDecimal zero0 = BigDecimal.ZERO.setScale(token0.getDecimals());
            BigDecimal zero1 = BigDecimal.ZERO.setScale(token1.getDecimals());
            return new UnclaimedFees(token0.getSymbol(), token1.getSymbol(), zero0, zero1,
                    zero1, zero1, zero1, price, StakingReward.NONE);
        }
        PositionManagerReader.CollectAmounts raw;
        try {
            raw = positionManagerReader.simulateCollect(position.getChainId(), position.getPositionManager(),
                    position.getTokenId(), nftHolder(position));
        } catch (RpcException | IllegalStateException e) {
            log.warn("Fee simulation for position {} failed: {}", position.getId(), e.getMessage());
            throw new FeeSimulationException("collect simulation failed for position " + position.getId(), e);
        }
        BigDecimal amount0 = LiquidityMath.toDecimal(raw.amount0(), token0.getDecimals());
        BigDecimal amount1 = LiquidityMath.toDecimal(raw.amount1(), token1.getDecimals());
        BigDecimal value0 = valueInToken1(amount0, BigDecimal.ZERO, price, token1.getDecimals());
        return new UnclaimedFees(token0.getSymbol(), token1.getSymbol(), amount0, amount1,
                value0, amount1, value0.add(amount1), price, stakingReward(position));
    }

    /**
     * Pending reward of a staked position; zero without a remote call when not staked.
     * Raw reads are memoised per position for a minute.
     */
    public StakingReward stakingReward(Position position) {
        if (!position.isStaked()) {
            return StakingReward.NONE;
        }
        ChainProperties.ChainEntry chain = chainProperties.chain(position.getChainId());
        if (chain.getStaker() == null) {
            return StakingReward.NONE;
        }
        BigInteger raw = CachedCall.get(cacheManager, CaffeineConfig.STAKING_REWARD_CACHE, position.getId(),
                () -> stakerReader.pendingReward(position.getChainId(), chain.getStaker(), position.getTokenId()));
        return new StakingReward(LiquidityMath.toDecimal(raw, chain.getRewardTokenDecimals()));
    }

    /**
     * Closed, or worth less than the dust threshold.
     */
    public boolean isEmpty(Position position) {
        if (position.isClosed()) {
            return true;
        }
        return combinedValue(position).compareTo(valuationProperties.getDustThreshold()) < 0;
    }

    private String nftHolder(Position position) {
        if (position.isStaked()) {
            String staker = chainProperties.chain(position.getChainId()).getStaker();
            if (staker != null) {
                return staker;
            }
        }
        return position.getOwner();
    }

    private static BigDecimal valueInToken1(BigDecimal amount0, BigDecimal amount1, Price price, int decimals1) {
        if (price.isInfinite()) {
            return amount1;
        }
        return amount0.multiply(price.value()).add(amount1).setScale(decimals1, RoundingMode.DOWN);
    }
}
