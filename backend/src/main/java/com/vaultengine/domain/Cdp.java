package com.vaultengine.domain;

import com.vaultengine.common.FixedPointMath;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Collateralized Debt Position. Immutable: every transition produces a new value through
 * {@link #transition(BigInteger, BigInteger, CdpState, Instant)}, which bumps {@link #getVersion()} so the
 * persistence layer can commit with compare-and-swap.
 * Amounts are 18-decimal fixed point and never negative.
 * <p>
 * Stability fee accrues on the debt as simple interest from {@link #getUpdatedAt()}. A transition folds the fee
 * pending up to its time into {@link #getAccruedFees()} before moving {@code updatedAt}, so no accrued fee is lost.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Cdp {

    /** 365.25 days. */
    public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(31_557_600L);

    private final String id;
    private final String owner;
    private final String collateralType;
    private final BigInteger collateralAmount;
    private final BigInteger debtAmount;
    private final CdpState state;
    private final CdpConfig config;
    private final BigInteger accruedFees;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    @Builder(toBuilder = true)
    public Cdp(String id, String owner, String collateralType, BigInteger collateralAmount, BigInteger debtAmount,
               CdpState state, CdpConfig config, BigInteger accruedFees, Instant createdAt, Instant updatedAt,
               long version) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.collateralType = Objects.requireNonNull(collateralType, "collateralType must not be null");
        this.collateralAmount = nonNegative(collateralAmount, "collateralAmount");
        this.debtAmount = nonNegative(debtAmount, "debtAmount");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.accruedFees = accruedFees != null ? nonNegative(accruedFees, "accruedFees") : BigInteger.ZERO;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative, got: " + version);
        }
        this.version = version;
    }

    /**
     * New CDP with the given quantities and state, stamped at {@code at}, version + 1. Identity, owner, config
     * and creation time carry over; the fee pending on the current debt up to {@code at} is added to the
     * accrued fees.
     */
    public Cdp transition(BigInteger newCollateralAmount, BigInteger newDebtAmount, CdpState newState, Instant at) {
        Objects.requireNonNull(at, "transition time must not be null");
        return toBuilder()
                .collateralAmount(newCollateralAmount)
                .debtAmount(newDebtAmount)
                .state(newState)
                .accruedFees(accruedFees.add(pendingStabilityFee(at)))
                .updatedAt(at)
                .version(version + 1)
                .build();
    }

    /**
     * Fee owed on the current debt since {@code updatedAt}, floored:
     * debt * stabilityFeeBps * elapsedSeconds / (10000 * SECONDS_PER_YEAR). Zero when {@code at} is not later.
     */
    public BigInteger pendingStabilityFee(Instant at) {
        long elapsed = Duration.between(updatedAt, at).getSeconds();
        if (elapsed <= 0 || !hasDebt() || config.getStabilityFeeBps() == 0) {
            return BigInteger.ZERO;
        }
        return debtAmount
                .multiply(BigInteger.valueOf(config.getStabilityFeeBps()))
                .multiply(BigInteger.valueOf(elapsed))
                .divide(FixedPointMath.BPS_DENOMINATOR.multiply(SECONDS_PER_YEAR));
    }

    public CdpStateType getStateType() {
        return state.type();
    }

    public boolean hasDebt() {
        return debtAmount.signum() > 0;
    }

    private static BigInteger nonNegative(BigInteger value, String field) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, got: " + value);
        }
        return value;
    }
}
