package com.lpradar.domain;

import java.math.BigInteger;

/**
 * Identity of an NFT liquidity position: {@code chainId:positionManagerAddress:tokenId}.
 */
public record PositionKey(long chainId, String positionManager, BigInteger tokenId) {

    public PositionKey {
        positionManager = Keys.normalizeAddress(positionManager);
        if (tokenId == null || tokenId.signum() < 0) {
            throw new IllegalArgumentException("tokenId must be a non-negative integer: " + tokenId);
        }
    }

    public static PositionKey parse(String id) {
        String[] parts = Keys.split(id, 3, "position");
        BigInteger tokenId;
        try {
            tokenId = new BigInteger(parts[2]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid position id: " + id, e);
        }
        return new PositionKey(Keys.parseChainId(parts[0], id), parts[1], tokenId);
    }

    public String id() {
        return chainId + ":" + positionManager + ":" + tokenId;
    }

    @Override
    public String toString() {
        return id();
    }
}
