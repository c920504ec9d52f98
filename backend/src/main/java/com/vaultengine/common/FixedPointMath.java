package com.vaultengine.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Fixed-point helpers for 18-decimal amounts and basis-point ratios. Everything is BigInteger, so intermediate
 * products never overflow and no floating point touches an amount.
 * Division rounds down unless the method name says otherwise.
 */
public final class FixedPointMath {

    public static final int DECIMALS = 18;

    /** 10^18: one whole unit of collateral, stablecoin or price. */
    public static final BigInteger SCALE = BigInteger.TEN.pow(DECIMALS);

    /** 10000 bps = 100%. */
    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private FixedPointMath() {
    }

    /**
     * floor(a * b / divisor). Operands must be non-negative, divisor positive.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger divisor) {
        requirePositive(divisor, "divisor");
        return requireNonNegative(a, "a").multiply(requireNonNegative(b, "b")).divide(divisor);
    }

    /**
     * ceil(a * b / divisor). Operands must be non-negative, divisor positive.
     */
    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger divisor) {
        return ceilDiv(requireNonNegative(a, "a").multiply(requireNonNegative(b, "b")), divisor);
    }

    /**
     * ceil(dividend / divisor) for a non-negative dividend and positive divisor.
     */
    public static BigInteger ceilDiv(BigInteger dividend, BigInteger divisor) {
        requirePositive(divisor, "divisor");
        BigInteger[] qr = requireNonNegative(dividend, "dividend").divideAndRemainder(divisor);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    /**
     * floor(amount * bps / 10000).
     */
    public static BigInteger applyBps(BigInteger amount, BigInteger bps) {
        return mulDiv(amount, bps, BPS_DENOMINATOR);
    }

    /**
     * Value of {@code amount} units at {@code price} (both 18-decimal), floored: amount * price / 10^18.
     */
    public static BigInteger value(BigInteger amount, BigInteger price) {
        return mulDiv(amount, price, SCALE);
    }

    /**
     * Converts a human-readable decimal (e.g. 2000.5) to its 18-decimal integer representation.
     *
     * @throws ArithmeticException if the value has more than 18 fractional digits
     */
    public static BigInteger fromDecimal(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("decimal value must not be null");
        }
        return value.movePointRight(DECIMALS).toBigIntegerExact();
    }

    /**
     * 18-decimal integer back to a plain decimal, trailing zeros stripped. For logs and display only.
     */
    public static BigDecimal toDecimal(BigInteger scaled) {
        BigDecimal d = new BigDecimal(scaled, DECIMALS).stripTrailingZeros();
        return d.scale() < 0 ? d.setScale(0) : d;
    }

    public static BigInteger requireNonNegative(BigInteger value, String name) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + value);
        }
        return value;
    }

    public static BigInteger requirePositive(BigInteger value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }
}
