package com.lpradar.cache;

import com.lpradar.chain.ContractRevertException;
import com.lpradar.chain.LogPoller;
import com.lpradar.chain.SwapLog;
import com.lpradar.chain.SwapLogDecoder;
import com.lpradar.chain.config.ChainProperties;
import com.lpradar.chain.contract.Erc20Reader;
import com.lpradar.chain.contract.PoolFactoryReader;
import com.lpradar.chain.contract.V3PoolReader;
import com.lpradar.common.CachedCall;
import com.lpradar.config.CaffeineConfig;
import com.lpradar.domain.Pool;
import com.lpradar.domain.PoolKey;
import com.lpradar.domain.PoolRepository;
import com.lpradar.domain.Token;
import com.lpradar.domain.TokenKey;
import com.lpradar.pricing.LiquidityMath;
import com.lpradar.pricing.Price;
import com.lpradar.pricing.PriceMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Pool cache. Hydration reads the pool's immutables and live state and stores both tokens first;
 * the pool keeps only token ids. Also owns the swap log subscription of a pool.
 */
@Slf4j
@Component
public class PoolCache extends LazyEntityCache<PoolKey, Pool> {

    private final PoolRepository poolRepository;
    private final TokenCache tokenCache;
    private final V3PoolReader poolReader;
    private final PoolFactoryReader factoryReader;
    private final Erc20Reader erc20Reader;
    private final ChainProperties chainProperties;
    private final LogPoller logPoller;
    private final CacheManager cacheManager;

    public PoolCache(PoolRepository poolRepository, TokenCache tokenCache, V3PoolReader poolReader,
                     PoolFactoryReader factoryReader, Erc20Reader erc20Reader, ChainProperties chainProperties,
                     LogPoller logPoller, CacheManager cacheManager) {
        super(poolRepository, "pool");
        this.poolRepository = poolRepository;
        this.tokenCache = tokenCache;
        this.poolReader = poolReader;
        this.factoryReader = factoryReader;
        this.erc20Reader = erc20Reader;
        this.chainProperties = chainProperties;
        this.logPoller = logPoller;
        this.cacheManager = cacheManager;
    }

    @Override
    protected String idOf(PoolKey key) {
        return key.id();
    }

    @Override
    protected Pool hydrate(PoolKey key) {
        V3PoolReader.PoolImmutables immutables;
        V3PoolReader.Slot0 slot0;
        BigInteger liquidity;
        try {
            immutables = poolReader.immutables(key.chainId(), key.address());
            slot0 = poolReader.slot0(key.chainId(), key.address());
            liquidity = poolReader.liquidity(key.chainId(), key.address());
        } catch (ContractRevertException | IllegalStateException e) {
            throw notFound(key, e.getMessage(), e);
        }
        if (immutables.token0().equals(immutables.token1())) {
            throw notFound(key, "token0 equals token1", null);
        }
        Token token0 = tokenCache.fetchOrCreate(new TokenKey(key.chainId(), immutables.token0()));
        Token token1 = tokenCache.fetchOrCreate(new TokenKey(key.chainId(), immutables.token1()));

        Pool pool = new Pool();
        pool.setId(key.id());
        pool.setChainId(key.chainId());
        pool.setAddress(key.address());
        pool.setToken0Id(token0.getId());
        pool.setToken1Id(token1.getId());
        pool.setFee(immutables.fee());
        pool.setTickSpacing(immutables.tickSpacing());
        pool.setToken0(token0);
        pool.setToken1(token1);
        applyState(pool, slot0.sqrtPriceX96(), slot0.tick(), liquidity);
        pool.setCreatedAt(pool.getUpdatedAt());
        return pool;
    }

    /**
     * Attaches both tokens. A token missing from the store (cleared or deleted out of band) is
     * hydrated again and stored before the pool is returned.
     */
    @Override
    protected Pool resolve(Pool pool) {
        if (pool.getToken0() == null) {
            pool.setToken0(resolveToken(pool, pool.getToken0Id()));
        }
        if (pool.getToken1() == null) {
            pool.setToken1(resolveToken(pool, pool.getToken1Id()));
        }
        return pool;
    }

    private Token resolveToken(Pool pool, String tokenId) {
        TokenKey key = TokenKey.parse(tokenId);
        return tokenCache.get(key).orElseGet(() -> {
            log.warn("Token {} of pool {} missing from store, re-hydrating", key, pool.getId());
            return tokenCache.fetchOrCreate(key);
        });
    }

    /**
     * Pool for a token pair and fee tier. Looks up the store in both token orders, then asks the
     * factory for the address.
     *
     * @throws EntityNotFoundUpstreamException when the factory has no such pool
     */
    public Pool fetchByTokens(long chainId, String tokenA, String tokenB, int fee) {
        TokenKey a = new TokenKey(chainId, tokenA);
        TokenKey b = new TokenKey(chainId, tokenB);
        Optional<Pool> stored = poolRepository.findByChainIdAndToken0IdAndToken1IdAndFee(chainId, a.id(), b.id(), fee)
                .or(() -> poolRepository.findByChainIdAndToken0IdAndToken1IdAndFee(chainId, b.id(), a.id(), fee));
        if (stored.isPresent()) {
            return resolve(stored.get());
        }
        String factory = chainProperties.chain(chainId).getPoolFactory();
        String address = factoryReader.getPool(chainId, factory, a.address(), b.address(), fee)
                .orElseThrow(() -> new EntityNotFoundUpstreamException("pool",
                        chainId + ":" + a.address() + "/" + b.address() + "/" + fee, "factory returned no pool"));
        return fetchOrCreate(new PoolKey(chainId, address));
    }

    /** token1 per token0 at the pool's stored sqrt price. */
    public Price price(Pool pool) {
        Pool resolved = resolve(pool);
        return PriceMath.price(resolved.getSqrtPriceX96(), resolved.getToken0().getDecimals(), resolved.getToken1().getDecimals());
    }

    /**
     * Re-reads slot0 and liquidity and persists them. slot0 reads are memoised briefly per pool.
     */
    public Pool refresh(Pool pool) {
        Pool resolved = resolve(pool);
        long chainId = resolved.getChainId();
        V3PoolReader.Slot0 slot0 = CachedCall.get(cacheManager, CaffeineConfig.SLOT0_CACHE, resolved.getId(),
                () -> poolReader.slot0(chainId, resolved.getAddress()));
        BigInteger liquidity = poolReader.liquidity(chainId, resolved.getAddress());
        applyState(resolved, slot0.sqrtPriceX96(), slot0.tick(), liquidity);
        return poolRepository.save(resolved);
    }

    /**
     * Stores the state reported by a swap. Liquidity is kept when the event carries none.
     *
     * @return the price after the swap
     */
    public Price applySwap(Pool pool, SwapLog swap) {
        Pool resolved = resolve(pool);
        applyState(resolved, swap.sqrtPriceX96(), swap.tick(), swap.liquidity());
        poolRepository.save(resolved);
        return PriceMath.price(swap.sqrtPriceX96(), resolved.getToken0().getDecimals(), resolved.getToken1().getDecimals());
    }

    /**
     * Pool balances of both tokens, valued in token1 at the current price. Balances are memoised briefly.
     */
    public PoolTvl tvl(Pool pool) {
        Pool resolved = resolve(pool);
        Token token0 = resolved.getToken0();
        Token token1 = resolved.getToken1();
        BigDecimal amount0 = LiquidityMath.toDecimal(balance(resolved, token0), token0.getDecimals());
        BigDecimal amount1 = LiquidityMath.toDecimal(balance(resolved, token1), token1.getDecimals());
        Price price = price(resolved);
        BigDecimal value = price.isInfinite()
                ? amount1
                : amount0.multiply(price.value()).add(amount1).setScale(token1.getDecimals(), RoundingMode.DOWN);
        return new PoolTvl(amount0, amount1, value);
    }

    private BigInteger balance(Pool pool, Token token) {
        return CachedCall.get(cacheManager, CaffeineConfig.TOKEN_BALANCE_CACHE, token.getId() + "@" + pool.getAddress(),
                () -> erc20Reader.balanceOf(pool.getChainId(), token.getAddress(), pool.getAddress()));
    }

    /**
     * Subscribes to the pool's swap logs. Logs that fail to decode are logged and skipped.
     *
     * @return handle that stops the subscription
     */
    public Disposable watchSwaps(Pool pool, Consumer<SwapLog> onSwap) {
        String topic = swapTopic(pool.getChainId());
        log.info("Subscribing to swaps of pool {} ({})", pool.getId(), pool.pairLabel());
        return logPoller.subscribe(pool.getChainId(), pool.getAddress(), topic,
                record -> onSwap.accept(SwapLogDecoder.decode(record)));
    }

    /** Configured topic0: a hex topic, or one of the aliases {@code uniswap-v3} / {@code pancakeswap-v3}. */
    String swapTopic(long chainId) {
        String configured = chainProperties.chain(chainId).getSwapEventTopic();
        if (configured == null || configured.isBlank() || configured.equalsIgnoreCase("uniswap-v3")) {
            return SwapLogDecoder.UNISWAP_V3_SWAP_TOPIC;
        }
        if (configured.equalsIgnoreCase("pancakeswap-v3")) {
            return SwapLogDecoder.PANCAKE_V3_SWAP_TOPIC;
        }
        return configured.toLowerCase();
    }

    private void applyState(Pool pool, BigInteger sqrtPriceX96, int tick, BigInteger liquidity) {
        pool.setSqrtPriceX96(sqrtPriceX96);
        pool.setTick(tick);
        if (liquidity != null) {
            pool.setLiquidity(liquidity);
        }
        Price price = PriceMath.price(sqrtPriceX96, pool.getToken0().getDecimals(), pool.getToken1().getDecimals());
        pool.setLastPrice(price.toDecimal().orElse(null));
        pool.setUpdatedAt(Instant.now());
    }
}
