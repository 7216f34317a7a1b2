package com.lpradar.cache;

import com.lpradar.InMemoryStore;
import com.lpradar.TestFixtures;
import com.lpradar.chain.ContractRevertException;
import com.lpradar.chain.contract.PositionManagerReader;
import com.lpradar.chain.contract.StakerReader;
import com.lpradar.domain.Pool;
import com.lpradar.domain.Position;
import com.lpradar.domain.PositionKey;
import com.lpradar.domain.PositionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static com.lpradar.TestFixtures.CHAIN;
import static com.lpradar.TestFixtures.MANAGER;
import static com.lpradar.TestFixtures.STAKER;
import static com.lpradar.TestFixtures.USDC;
import static com.lpradar.TestFixtures.WALLET;
import static com.lpradar.TestFixtures.WETH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PositionCacheTest {

    private static final BigInteger LIQUIDITY = new BigInteger("7000000000000");
    private static final String OTHER = "0x3333333333333333333333333333333333333333";

    @Mock
    private PositionRepository positionRepository;
    @Mock
    private PoolCache poolCache;
    @Mock
    private PositionManagerReader managerReader;
    @Mock
    private StakerReader stakerReader;

    private InMemoryStore<Position> store;
    private PositionCache positionCache;

    @BeforeEach
    void setUp() {
        store = InMemoryStore.backing(positionRepository, Position.class, Position::getId);
        positionCache = new PositionCache(positionRepository, poolCache, managerReader, stakerReader,
                TestFixtures.chainProperties(true));
    }

    private static PositionManagerReader.PositionData data(BigInteger liquidity) {
        return new PositionManagerReader.PositionData(WETH, USDC, 500, -195_000, -194_000, liquidity, BigInteger.ZERO, BigInteger.ZERO);
    }

    private static PositionKey key(long tokenId) {
        return new PositionKey(CHAIN, MANAGER, BigInteger.valueOf(tokenId));
    }

    @Test
    void fetchOrCreate_heldNft_ownerIsHolder() {
        Pool pool = TestFixtures.pool();
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(data(LIQUIDITY));
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(WALLET);
        when(poolCache.fetchByTokens(CHAIN, WETH, USDC, 500)).thenReturn(pool);

        Position position = positionCache.fetchOrCreate(key(1));

        assertThat(position.getOwner()).isEqualTo(WALLET);
        assertThat(position.isStaked()).isFalse();
        assertThat(position.getPoolId()).isEqualTo(pool.getId());
        assertThat(position.getPool()).isSameAs(pool);
        assertThat(position.getTickLower()).isEqualTo(-195_000);
        assertThat(position.getTickUpper()).isEqualTo(-194_000);
        assertThat(position.isClosed()).isFalse();
        assertThat(store.find(position.getId())).isPresent();
        verifyNoInteractions(stakerReader);
    }

    @Test
    void fetchOrCreate_stakedNft_ownerIsStakingWallet() {
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(data(LIQUIDITY));
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(STAKER);
        when(stakerReader.stakedBy(CHAIN, STAKER, BigInteger.ONE)).thenReturn(Optional.of(WALLET));
        when(poolCache.fetchByTokens(CHAIN, WETH, USDC, 500)).thenReturn(TestFixtures.pool());

        Position position = positionCache.fetchOrCreate(key(1));

        assertThat(position.isStaked()).isTrue();
        assertThat(position.getOwner()).isEqualTo(WALLET);
    }

    @Test
    void fetchOrCreate_burnedToken_notFoundAndPoolUntouched() {
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.TEN)).thenThrow(new ContractRevertException("Invalid token ID"));

        assertThatThrownBy(() -> positionCache.fetchOrCreate(key(10)))
                .isInstanceOf(EntityNotFoundUpstreamException.class)
                .hasMessageContaining("Invalid token ID");
        verifyNoInteractions(poolCache);
        assertThat(store.size()).isZero();
    }

    @Test
    void get_poolMissingFromStore_rehydratesPool() {
        Position stored = TestFixtures.position(BigInteger.ONE, -195_000, -194_000, LIQUIDITY);
        stored.setPool(null);
        store.put(stored.getId(), stored);
        when(poolCache.get(TestFixtures.poolKey())).thenReturn(Optional.empty());
        when(poolCache.fetchOrCreate(TestFixtures.poolKey())).thenReturn(TestFixtures.pool());

        Position position = positionCache.get(key(1)).orElseThrow();

        assertThat(position.getPool()).isNotNull();
        verify(poolCache).fetchOrCreate(TestFixtures.poolKey());
        verifyNoInteractions(managerReader);
    }

    @Test
    void refresh_unchanged_notPersisted() {
        Position position = TestFixtures.position(BigInteger.ONE, -195_000, -194_000, LIQUIDITY);
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(data(LIQUIDITY));
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(WALLET);

        positionCache.refresh(position);

        verify(positionRepository, never()).save(any(Position.class));
    }

    @Test
    void refresh_liquidityRemoved_persistsClosedPosition() {
        Position position = TestFixtures.position(BigInteger.ONE, -195_000, -194_000, LIQUIDITY);
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(data(BigInteger.ZERO));
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(WALLET);

        Position refreshed = positionCache.refresh(position);

        assertThat(refreshed.isClosed()).isTrue();
        assertThat(store.find(position.getId())).containsSame(position);
    }

    @Test
    void scanWallet_heldAndStakedPositions_hydratesNewRefreshesKnownAndOldOnes() {
        Position known = TestFixtures.position(BigInteger.ONE, -195_000, -194_000, LIQUIDITY);
        store.put(known.getId(), known);
        Position transferred = TestFixtures.position(BigInteger.valueOf(9), -195_000, -194_000, LIQUIDITY);
        store.put(transferred.getId(), transferred);

        when(managerReader.balanceOf(CHAIN, MANAGER, WALLET)).thenReturn(2);
        when(managerReader.tokenOfOwnerByIndex(CHAIN, MANAGER, WALLET, 1)).thenReturn(BigInteger.TWO);
        when(managerReader.tokenOfOwnerByIndex(CHAIN, MANAGER, WALLET, 0)).thenReturn(BigInteger.ONE);
        when(stakerReader.stakedCount(CHAIN, STAKER, WALLET)).thenReturn(1);
        when(stakerReader.stakedTokenByIndex(CHAIN, STAKER, WALLET, 0)).thenReturn(BigInteger.valueOf(3));
        when(stakerReader.stakedBy(CHAIN, STAKER, BigInteger.valueOf(3))).thenReturn(Optional.of(WALLET));
        when(managerReader.positions(eq(CHAIN), eq(MANAGER), any())).thenReturn(data(LIQUIDITY));
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.ONE)).thenReturn(WALLET);
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.TWO)).thenReturn(WALLET);
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.valueOf(3))).thenReturn(STAKER);
        when(managerReader.ownerOf(CHAIN, MANAGER, BigInteger.valueOf(9))).thenReturn(OTHER);
        when(poolCache.fetchByTokens(CHAIN, WETH, USDC, 500)).thenReturn(TestFixtures.pool());
        when(positionRepository.findByChainIdAndOwner(CHAIN, WALLET)).thenReturn(List.of(known, transferred));

        List<Position> positions = positionCache.scanWallet(CHAIN, WALLET.toUpperCase().replace("0X", "0x"));

        assertThat(positions).extracting(Position::getTokenId)
                .containsExactly(BigInteger.TWO, BigInteger.ONE, BigInteger.valueOf(3));
        assertThat(positions.get(2).isStaked()).isTrue();
        assertThat(store.find(transferred.getId()).orElseThrow().getOwner()).isEqualTo(OTHER);
        assertThat(store.size()).isEqualTo(4);
    }

    @Test
    void scanWallet_unreadableToken_skipped() {
        when(managerReader.balanceOf(CHAIN, MANAGER, WALLET)).thenReturn(1);
        when(managerReader.tokenOfOwnerByIndex(eq(CHAIN), eq(MANAGER), eq(WALLET), anyInt())).thenReturn(BigInteger.ONE);
        when(managerReader.positions(CHAIN, MANAGER, BigInteger.ONE)).thenThrow(new IllegalStateException("positions(1) returned 0 words"));
        when(positionRepository.findByChainIdAndOwner(CHAIN, WALLET)).thenReturn(List.of());

        assertThat(positionCache.scanWallet(CHAIN, WALLET)).isEmpty();
    }
}
