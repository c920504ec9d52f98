package com.vaultengine.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exact rational health factor: liquidation-adjusted collateral value / debt.
 * At or below 1.0 a position is liquidatable. Zero debt is represented by the {@link #MAX} sentinel, never by a
 * division. Comparison is by cross-multiplication, so no precision is lost.
 */
public final class HealthFactor implements Comparable<HealthFactor> {

    /** Sentinel for a position without debt. Compares above every finite health factor. */
    public static final HealthFactor MAX = new HealthFactor(null, null);

    public static final HealthFactor ONE = new HealthFactor(BigInteger.ONE, BigInteger.ONE);

    /** Decimal shown for {@link #MAX}. */
    public static final BigDecimal UNBOUNDED_DECIMAL = BigDecimal.valueOf(Long.MAX_VALUE);

    /** Basis-point value reported for {@link #MAX}. */
    public static final BigInteger UNBOUNDED_BPS = BigInteger.valueOf(Long.MAX_VALUE);

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private HealthFactor(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * @param numerator   liquidation-adjusted collateral value, non-negative
     * @param denominator debt, positive
     */
    public static HealthFactor of(BigInteger numerator, BigInteger denominator) {
        if (numerator == null || numerator.signum() < 0) {
            throw new IllegalArgumentException("Health factor numerator must be non-negative, got: " + numerator);
        }
        if (denominator == null || denominator.signum() <= 0) {
            throw new IllegalArgumentException("Health factor denominator must be positive, got: " + denominator);
        }
        return new HealthFactor(numerator, denominator);
    }

    /**
     * Health factor from a basis-point value, e.g. 11000 = 1.1.
     */
    public static HealthFactor ofBps(long bps) {
        return of(BigInteger.valueOf(bps), BPS);
    }

    public boolean isUnbounded() {
        return numerator == null;
    }

    /** True when the position is eligible for liquidation (health factor &lt;= 1.0). */
    public boolean isLiquidatable() {
        return compareTo(ONE) <= 0;
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    /**
     * Health factor in basis points, rounded down; {@link #UNBOUNDED_BPS} for {@link #MAX}.
     */
    public BigInteger toBps() {
        if (isUnbounded()) {
            return UNBOUNDED_BPS;
        }
        return numerator.multiply(BPS).divide(denominator);
    }

    /**
     * Decimal approximation for display and logs, rounded down.
     */
    public BigDecimal toBigDecimal(int scale) {
        if (isUnbounded()) {
            return UNBOUNDED_DECIMAL;
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), scale, RoundingMode.DOWN);
    }

    @Override
    public int compareTo(HealthFactor other) {
        if (isUnbounded() || other.isUnbounded()) {
            return Boolean.compare(isUnbounded(), other.isUnbounded());
        }
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareTo((HealthFactor) o) == 0;
    }

    @Override
    public int hashCode() {
        if (isUnbounded()) {
            return Integer.MAX_VALUE;
        }
        BigInteger gcd = numerator.gcd(denominator);
        return Objects.hash(numerator.divide(gcd), denominator.divide(gcd));
    }

    @Override
    public String toString() {
        return isUnbounded() ? "MAX" : toBigDecimal(6).toPlainString();
    }
}
