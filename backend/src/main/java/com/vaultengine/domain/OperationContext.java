package com.vaultengine.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call market and protocol inputs. Supplied by the caller, never retained by the engine.
 * The engine reads time only from here and from the operation itself.
 */
@Getter
@ToString
public final class OperationContext {

    /** Collateral price in stablecoin, 18 decimals. Always positive. */
    private final BigInteger collateralPrice;
    /** Largest single withdrawal, collateral units. */
    private final BigInteger maxWithdrawAmount;
    /** Added to the minimum collateralization ratio for WITHDRAW and MINT. */
    private final int safetyBufferBps;
    private final boolean emergencyShutdown;
    private final Instant currentTime;
    /** Largest single deposit; null = unlimited. */
    private final BigInteger maxDepositAmount;
    /** Largest single mint; null = unlimited. */
    private final BigInteger maxMintAmount;
    /** Largest single burn; null = unlimited. */
    private final BigInteger maxBurnAmount;
    /** System-wide debt ceiling across all CDPs; null = none. */
    private final BigInteger globalDebtCeiling;
    /** Debt outstanding across all CDPs before this operation. Defaults to zero. */
    private final BigInteger currentTotalDebt;

    @Builder
    public OperationContext(BigInteger collateralPrice, BigInteger maxWithdrawAmount, int safetyBufferBps,
                            boolean emergencyShutdown, Instant currentTime, BigInteger maxDepositAmount,
                            BigInteger maxMintAmount, BigInteger maxBurnAmount, BigInteger globalDebtCeiling,
                            BigInteger currentTotalDebt) {
        if (collateralPrice == null || collateralPrice.signum() <= 0) {
            throw new IllegalArgumentException("collateralPrice must be positive, got: " + collateralPrice);
        }
        if (maxWithdrawAmount == null || maxWithdrawAmount.signum() < 0) {
            throw new IllegalArgumentException("maxWithdrawAmount must be non-negative, got: " + maxWithdrawAmount);
        }
        if (safetyBufferBps < 0) {
            throw new IllegalArgumentException("safetyBufferBps must be non-negative, got: " + safetyBufferBps);
        }
        if (maxDepositAmount != null && maxDepositAmount.signum() < 0) {
            throw new IllegalArgumentException("maxDepositAmount must be non-negative, got: " + maxDepositAmount);
        }
        if (maxMintAmount != null && maxMintAmount.signum() < 0) {
            throw new IllegalArgumentException("maxMintAmount must be non-negative, got: " + maxMintAmount);
        }
        if (maxBurnAmount != null && maxBurnAmount.signum() < 0) {
            throw new IllegalArgumentException("maxBurnAmount must be non-negative, got: " + maxBurnAmount);
        }
        if (globalDebtCeiling != null && globalDebtCeiling.signum() < 0) {
            throw new IllegalArgumentException("globalDebtCeiling must be non-negative, got: " + globalDebtCeiling);
        }
        if (currentTotalDebt != null && currentTotalDebt.signum() < 0) {
            throw new IllegalArgumentException("currentTotalDebt must be non-negative, got: " + currentTotalDebt);
        }
        this.collateralPrice = collateralPrice;
        this.maxWithdrawAmount = maxWithdrawAmount;
        this.safetyBufferBps = safetyBufferBps;
        this.emergencyShutdown = emergencyShutdown;
        this.currentTime = Objects.requireNonNull(currentTime, "currentTime must not be null");
        this.maxDepositAmount = maxDepositAmount;
        this.maxMintAmount = maxMintAmount;
        this.maxBurnAmount = maxBurnAmount;
        this.globalDebtCeiling = globalDebtCeiling;
        this.currentTotalDebt = currentTotalDebt != null ? currentTotalDebt : BigInteger.ZERO;
    }

    /**
     * Same inputs with a different system-wide debt total, for batches that track the debt they add.
     */
    public OperationContext withCurrentTotalDebt(BigInteger totalDebt) {
        return new OperationContext(collateralPrice, maxWithdrawAmount, safetyBufferBps, emergencyShutdown,
                currentTime, maxDepositAmount, maxMintAmount, maxBurnAmount, globalDebtCeiling, totalDebt);
    }

    public Optional<BigInteger> getMaxDepositAmount() {
        return Optional.ofNullable(maxDepositAmount);
    }

    public Optional<BigInteger> getMaxMintAmount() {
        return Optional.ofNullable(maxMintAmount);
    }

    public Optional<BigInteger> getMaxBurnAmount() {
        return Optional.ofNullable(maxBurnAmount);
    }

    public Optional<BigInteger> getGlobalDebtCeiling() {
        return Optional.ofNullable(globalDebtCeiling);
    }
}
