package com.lpradar.domain;

/**
 * Identity of a token: {@code chainId:address}, address lower-cased.
 */
public record TokenKey(long chainId, String address) {

    public TokenKey {
        address = Keys.normalizeAddress(address);
    }

    public static TokenKey parse(String id) {
        String[] parts = Keys.split(id, 2, "token");
        return new TokenKey(Keys.parseChainId(parts[0], id), parts[1]);
    }

    public String id() {
        return chainId + ":" + address;
    }

    @Override
    public String toString() {
        return id();
    }
}
