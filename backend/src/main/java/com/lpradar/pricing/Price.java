package com.lpradar.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Decimal price of token0 in token1, or the infinite sentinel produced by degenerate pool states
 * (zero sqrt price, inverting a zero price). Infinite compares greater than every finite price.
 */
public final class Price implements Comparable<Price> {

    public static final Price INFINITE = new Price(null);

    private static final String INFINITE_TEXT = "Infinity";

    private final BigDecimal value;

    private Price(BigDecimal value) {
        this.value = value;
    }

    public static Price of(BigDecimal value) {
        return new Price(Objects.requireNonNull(value, "value"));
    }

    public static Price of(String value) {
        return of(new BigDecimal(value));
    }

    public boolean isInfinite() {
        return value == null;
    }

    /**
     * @throws ArithmeticException for the infinite sentinel
     */
    public BigDecimal value() {
        if (value == null) {
            throw new ArithmeticException("Price is infinite");
        }
        return value;
    }

    public Optional<BigDecimal> toDecimal() {
        return Optional.ofNullable(value);
    }

    /**
     * token1-per-token0 ↔ token0-per-token1 at the given scale. Zero inverts to infinite and back.
     */
    public Price invert(int scale) {
        if (value == null) {
            return of(BigDecimal.ZERO.setScale(scale));
        }
        if (value.signum() == 0) {
            return INFINITE;
        }
        return of(BigDecimal.ONE.divide(value, scale, RoundingMode.HALF_UP));
    }

    /** Plain string keeping the scale (e.g. {@code 3578.96913182}), or {@code Infinity}. */
    public String format() {
        return value == null ? INFINITE_TEXT : value.toPlainString();
    }

    @Override
    public int compareTo(Price other) {
        if (value == null || other.value == null) {
            return Boolean.compare(value == null, other.value == null);
        }
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Price other)) {
            return false;
        }
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
