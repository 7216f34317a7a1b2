package com.lpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * V3 pool. token0/token1 are stored as token ids and resolved into {@link Token} by the pool cache;
 * token order is the factory's, never re-sorted. Live state (sqrt price, tick, liquidity, last price)
 * is updated in place from swap events.
 */
@Document(collection = "pools")
@CompoundIndex(name = "chain_pair_fee", def = "{'chainId': 1, 'token0Id': 1, 'token1Id': 1, 'fee': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Pool {

    /** chainId:poolAddress */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String address;
    private String token0Id;
    private String token1Id;
    /** Hundredths of a basis point (500 = 0.05%). */
    private int fee;
    private int tickSpacing;
    private BigInteger sqrtPriceX96;
    private Integer tick;
    private BigInteger liquidity;
    /** token1 per token0 at the last observed swap or refresh. */
    private BigDecimal lastPrice;
    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    private Token token0;
    @Transient
    private Token token1;

    public PoolKey key() {
        return new PoolKey(chainId, address);
    }

    /** True once both token references have been resolved. */
    public boolean isResolved() {
        return token0 != null && token1 != null;
    }

    public String pairLabel() {
        return isResolved() ? token1.getSymbol() + "/" + token0.getSymbol() : id;
    }
}
