package com.lpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * NFT liquidity position. Zero liquidity marks a closed position; the record is kept for lookup.
 */
@Document(collection = "positions")
@CompoundIndex(name = "chain_owner", def = "{'chainId': 1, 'owner': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Position {

    /** chainId:positionManager:tokenId */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String positionManager;
    private BigInteger tokenId;
    private String owner;
    private String poolId;
    private int tickLower;
    private int tickUpper;
    private BigInteger liquidity;
    private boolean staked;
    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    private Pool pool;

    public PositionKey key() {
        return new PositionKey(chainId, positionManager, tokenId);
    }

    public boolean isClosed() {
        return liquidity == null || liquidity.signum() == 0;
    }
}
