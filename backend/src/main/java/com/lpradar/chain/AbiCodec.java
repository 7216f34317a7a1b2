package com.lpradar.chain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal ABI codec for static-argument contract calls and their results.
 * Works on 32-byte words in hex; only the types used by ERC20, V3 pool, factory,
 * position manager and MasterChef reads are supported.
 */
public final class AbiCodec {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    public static final BigInteger MAX_UINT128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private static final int WORD_HEX = 64;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger MAX_INT256 = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    private AbiCodec() {
    }

    /** 4-byte function selector, e.g. {@code decimals()} → {@code 0x313ce567}. */
    public static String selector(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }

    /** topic0 of an event signature. */
    public static String eventTopic(String signature) {
        return Hash.sha3String(signature).toLowerCase(Locale.ROOT);
    }

    /**
     * Call data: selector followed by one word per argument. Accepts addresses (hex strings),
     * integers (BigInteger, Long, Integer; negative values in two's complement) and booleans.
     */
    public static String encodeCall(String selector, Object... args) {
        StringBuilder sb = new StringBuilder(selector);
        for (Object arg : args) {
            sb.append(encodeWord(arg));
        }
        return sb.toString();
    }

    static String encodeWord(Object arg) {
        if (arg instanceof String s) {
            return leftPad(Numeric.cleanHexPrefix(s).toLowerCase(Locale.ROOT));
        }
        if (arg instanceof Boolean b) {
            return leftPad(b ? "1" : "0");
        }
        BigInteger value;
        if (arg instanceof BigInteger bi) {
            value = bi;
        } else if (arg instanceof Long || arg instanceof Integer) {
            value = BigInteger.valueOf(((Number) arg).longValue());
        } else {
            throw new IllegalArgumentException("Unsupported ABI argument: " + arg);
        }
        if (value.signum() < 0) {
            value = value.add(TWO_256);
        }
        return leftPad(value.toString(16));
    }

    /** Splits a result into 32-byte words (hex, no prefix). Trailing partial word is dropped. */
    public static List<String> words(String hex) {
        String raw = hex == null ? "" : Numeric.cleanHexPrefix(hex);
        List<String> out = new ArrayList<>(raw.length() / WORD_HEX);
        for (int i = 0; i + WORD_HEX <= raw.length(); i += WORD_HEX) {
            out.add(raw.substring(i, i + WORD_HEX));
        }
        return out;
    }

    public static BigInteger decodeUint(String word) {
        return new BigInteger(word, 16);
    }

    /** Two's complement int256; narrower signed types are sign-extended by the ABI so this covers int24 too. */
    public static BigInteger decodeInt(String word) {
        BigInteger value = new BigInteger(word, 16);
        return value.compareTo(MAX_INT256) > 0 ? value.subtract(TWO_256) : value;
    }

    public static String decodeAddress(String word) {
        return "0x" + word.substring(WORD_HEX - 40).toLowerCase(Locale.ROOT);
    }

    public static boolean decodeBool(String word) {
        return new BigInteger(word, 16).signum() != 0;
    }

    /**
     * Decodes a string return value: dynamic ABI string (offset + length + data) or bytes32
     * (some older tokens such as MKR return symbol as bytes32).
     */
    public static String decodeString(String hex) {
        List<String> words = words(hex);
        if (words.isEmpty()) {
            return "";
        }
        BigInteger offset = decodeUint(words.get(0));
        if (words.size() >= 2 && offset.equals(BigInteger.valueOf(32))) {
            int len = decodeUint(words.get(1)).intValueExact();
            String raw = Numeric.cleanHexPrefix(hex);
            int start = 2 * WORD_HEX;
            if (raw.length() < start + len * 2) {
                throw new IllegalArgumentException("Truncated ABI string");
            }
            return new String(Numeric.hexStringToByteArray(raw.substring(start, start + len * 2)), StandardCharsets.UTF_8).trim();
        }
        byte[] bytes = Numeric.hexStringToByteArray(words.get(0));
        int end = 0;
        while (end < bytes.length && bytes[end] != 0) {
            end++;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8).trim();
    }

    public static boolean isEmptyResult(String hex) {
        return hex == null || Numeric.cleanHexPrefix(hex).isEmpty();
    }

    public static long hexToLong(String hex) {
        String raw = hex == null ? "" : Numeric.cleanHexPrefix(hex);
        return raw.isEmpty() ? 0L : new BigInteger(raw, 16).longValueExact();
    }

    public static String toHexQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        String trimmed = address.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("0x") ? trimmed : "0x" + trimmed;
    }

    private static String leftPad(String hex) {
        if (hex.length() > WORD_HEX) {
            throw new IllegalArgumentException("Value does not fit in one ABI word");
        }
        return "0".repeat(WORD_HEX - hex.length()) + hex;
    }
}
