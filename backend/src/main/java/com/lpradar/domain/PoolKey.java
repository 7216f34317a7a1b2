package com.lpradar.domain;

/**
 * Identity of a pool: {@code chainId:poolAddress}, address lower-cased.
 */
public record PoolKey(long chainId, String address) {

    public PoolKey {
        address = Keys.normalizeAddress(address);
    }

    public static PoolKey parse(String id) {
        String[] parts = Keys.split(id, 2, "pool");
        return new PoolKey(Keys.parseChainId(parts[0], id), parts[1]);
    }

    public String id() {
        return chainId + ":" + address;
    }

    @Override
    public String toString() {
        return id();
    }
}
