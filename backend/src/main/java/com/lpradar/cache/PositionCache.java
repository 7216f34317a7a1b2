package com.lpradar.cache;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ContractRevertException;
import com.lpradar.chain.config.ChainProperties;
import com.lpradar.chain.contract.PositionManagerReader;
import com.lpradar.chain.contract.StakerReader;
import com.lpradar.domain.Pool;
import com.lpradar.domain.PoolKey;
import com.lpradar.domain.Position;
import com.lpradar.domain.PositionKey;
import com.lpradar.domain.PositionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Position NFT cache. A position references its pool by id; the pool is hydrated first.
 * While a position is staked the NFT is held by the staker contract and the owner recorded here is
 * the wallet that staked it.
 */
@Slf4j
@Component
public class PositionCache extends LazyEntityCache<PositionKey, Position> {

    private final PositionRepository positionRepository;
    private final PoolCache poolCache;
    private final PositionManagerReader positionManagerReader;
    private final StakerReader stakerReader;
    private final ChainProperties chainProperties;

    public PositionCache(PositionRepository positionRepository, PoolCache poolCache,
                         PositionManagerReader positionManagerReader, StakerReader stakerReader,
                         ChainProperties chainProperties) {
        super(positionRepository, "position");
        this.positionRepository = positionRepository;
        this.poolCache = poolCache;
        this.positionManagerReader = positionManagerReader;
        this.stakerReader = stakerReader;
        this.chainProperties = chainProperties;
    }

    @Override
    protected String idOf(PositionKey key) {
        return key.id();
    }

    @Override
    protected Position hydrate(PositionKey key) {
        PositionManagerReader.PositionData data;
        String nftOwner;
        try {
            data = positionManagerReader.positions(key.chainId(), key.positionManager(), key.tokenId());
            nftOwner = positionManagerReader.ownerOf(key.chainId(), key.positionManager(), key.tokenId());
        } catch (ContractRevertException | IllegalStateException e) {
            throw notFound(key, e.getMessage(), e);
        }
        Pool pool = poolCache.fetchByTokens(key.chainId(), data.token0(), data.token1(), data.fee());

        Position position = new Position();
        position.setId(key.id());
        position.setChainId(key.chainId());
        position.setPositionManager(key.positionManager());
        position.setTokenId(key.tokenId());
        position.setPoolId(pool.getId());
        position.setPool(pool);
        position.setTickLower(data.tickLower());
        position.setTickUpper(data.tickUpper());
        position.setLiquidity(data.liquidity());
        applyOwnership(position, nftOwner);
        Instant now = Instant.now();
        position.setCreatedAt(now);
        position.setUpdatedAt(now);
        return position;
    }

    /**
     * Attaches the pool, re-hydrating it when it is missing from the store.
     */
    @Override
    protected Position resolve(Position position) {
        if (position.getPool() == null) {
            PoolKey key = PoolKey.parse(position.getPoolId());
            Pool pool = poolCache.get(key).orElseGet(() -> {
                log.warn("Pool {} of position {} missing from store, re-hydrating", key, position.getId());
                return poolCache.fetchOrCreate(key);
            });
            position.setPool(pool);
        }
        return position;
    }

    /**
     * Every position of {@code owner}: NFTs held directly and NFTs staked in the chain's staker.
     * New ones are hydrated, known ones refreshed. Stored positions of the owner that were not seen
     * are refreshed too, which records transfers and withdrawals. Reads are sequential to stay within
     * provider rate limits.
     */
    public List<Position> scanWallet(long chainId, String owner) {
        ChainProperties.ChainEntry chain = chainProperties.chain(chainId);
        String manager = chain.getPositionManager();
        String wallet = AbiCodec.normalizeAddress(owner);

        List<BigInteger> tokenIds = new ArrayList<>();
        int held = positionManagerReader.balanceOf(chainId, manager, wallet);
        for (int i = held - 1; i >= 0; i--) {
            tokenIds.add(positionManagerReader.tokenOfOwnerByIndex(chainId, manager, wallet, i));
        }
        if (chain.getStaker() != null) {
            int staked = stakerReader.stakedCount(chainId, chain.getStaker(), wallet);
            for (int i = staked - 1; i >= 0; i--) {
                tokenIds.add(stakerReader.stakedTokenByIndex(chainId, chain.getStaker(), wallet, i));
            }
        }

        List<Position> positions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BigInteger tokenId : tokenIds) {
            PositionKey key = new PositionKey(chainId, manager, tokenId);
            if (!seen.add(key.id())) {
                continue;
            }
            try {
                Optional<Position> stored = get(key);
                positions.add(stored.isPresent() ? refresh(stored.get()) : fetchOrCreate(key));
            } catch (EntityNotFoundUpstreamException e) {
                log.warn("Skipping position {} of {}: {}", key, wallet, e.getMessage());
            }
        }
        for (Position known : positionRepository.findByChainIdAndOwner(chainId, wallet)) {
            if (seen.contains(known.getId())) {
                continue;
            }
            try {
                Position refreshed = refresh(resolve(known));
                log.info("Position {} no longer listed for {}, owner now {}", known.getId(), wallet, refreshed.getOwner());
            } catch (EntityNotFoundUpstreamException e) {
                log.warn("Position {} no longer readable: {}", known.getId(), e.getMessage());
            }
        }
        log.info("Scanned {} positions for {} on chain {}", positions.size(), wallet, chainId);
        return positions;
    }

    /**
     * Re-reads liquidity, tick bounds, owner and staking status and persists them when changed.
     */
    public Position refresh(Position position) {
        PositionKey key = position.key();
        PositionManagerReader.PositionData data;
        String nftOwner;
        try {
            data = positionManagerReader.positions(key.chainId(), key.positionManager(), key.tokenId());
            nftOwner = positionManagerReader.ownerOf(key.chainId(), key.positionManager(), key.tokenId());
        } catch (ContractRevertException | IllegalStateException e) {
            throw notFound(key, e.getMessage(), e);
        }
        String ownerBefore = position.getOwner();
        boolean stakedBefore = position.isStaked();
        boolean changed = !Objects.equals(position.getLiquidity(), data.liquidity())
                || position.getTickLower() != data.tickLower()
                || position.getTickUpper() != data.tickUpper();
        position.setLiquidity(data.liquidity());
        position.setTickLower(data.tickLower());
        position.setTickUpper(data.tickUpper());
        applyOwnership(position, nftOwner);
        changed |= !Objects.equals(ownerBefore, position.getOwner()) || stakedBefore != position.isStaked();
        if (!changed) {
            return resolve(position);
        }
        position.setUpdatedAt(Instant.now());
        log.debug("Position {} changed on chain, persisting", position.getId());
        Position saved = positionRepository.save(position);
        return resolve(saved);
    }

    private void applyOwnership(Position position, String nftOwner) {
        String staker = chainProperties.chain(position.getChainId()).getStaker();
        if (staker != null && staker.equalsIgnoreCase(nftOwner)) {
            Optional<String> stakedBy = stakerReader.stakedBy(position.getChainId(), staker, position.getTokenId());
            position.setStaked(stakedBy.isPresent());
            position.setOwner(stakedBy.orElse(nftOwner));
        } else {
            position.setStaked(false);
            position.setOwner(nftOwner);
        }
    }
}
