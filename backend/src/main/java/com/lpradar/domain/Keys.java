package com.lpradar.domain;

import java.util.Locale;
import java.util.regex.Pattern;

final class Keys {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private Keys() {
    }

    static String normalizeAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address is required");
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return normalized;
    }

    static String[] split(String id, int parts, String kind) {
        if (id == null) {
            throw new IllegalArgumentException("Missing " + kind + " id");
        }
        String[] split = id.split(":");
        if (split.length != parts) {
            throw new IllegalArgumentException("Invalid " + kind + " id: " + id);
        }
        return split;
    }

    static long parseChainId(String value, String id) {
        try {
            long chainId = Long.parseLong(value);
            if (chainId <= 0) {
                throw new IllegalArgumentException("Invalid chain id in " + id);
            }
            return chainId;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chain id in " + id, e);
        }
    }
}
