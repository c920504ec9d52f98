package com.vaultengine.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Risk parameters of a CDP, fixed for its lifetime. Ratios and fees in basis points (10000 = 100%);
 * ceiling and floor in 18-decimal stablecoin units.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CdpConfig {

    /** Ratio a voluntary operation must keep, e.g. 15000 = 150%. */
    private final int minCollateralizationRatio;
    /** Ratio at which health factor is 1.0, e.g. 13000 = 130%. Never above the minimum ratio. */
    private final int liquidationRatio;
    private final int liquidationPenaltyBps;
    /** Annual stability fee. */
    private final int stabilityFeeBps;
    private final BigInteger debtCeiling;
    /** Minimum non-zero debt. */
    private final BigInteger debtFloor;

    @Builder
    public CdpConfig(int minCollateralizationRatio, int liquidationRatio, int liquidationPenaltyBps,
                     int stabilityFeeBps, BigInteger debtCeiling, BigInteger debtFloor) {
        if (minCollateralizationRatio <= 0) {
            throw new IllegalArgumentException("minCollateralizationRatio must be positive, got: " + minCollateralizationRatio);
        }
        if (liquidationRatio <= 0) {
            throw new IllegalArgumentException("liquidationRatio must be positive, got: " + liquidationRatio);
        }
        if (liquidationRatio > minCollateralizationRatio) {
            throw new IllegalArgumentException("liquidationRatio " + liquidationRatio
                    + " exceeds minCollateralizationRatio " + minCollateralizationRatio);
        }
        if (liquidationPenaltyBps < 0 || stabilityFeeBps < 0) {
            throw new IllegalArgumentException("Fees must be non-negative, got penalty=" + liquidationPenaltyBps
                    + " stabilityFee=" + stabilityFeeBps);
        }
        if (debtCeiling == null || debtCeiling.signum() < 0) {
            throw new IllegalArgumentException("debtCeiling must be non-negative, got: " + debtCeiling);
        }
        if (debtFloor == null || debtFloor.signum() < 0) {
            throw new IllegalArgumentException("debtFloor must be non-negative, got: " + debtFloor);
        }
        if (debtFloor.compareTo(debtCeiling) > 0) {
            throw new IllegalArgumentException("debtFloor " + debtFloor + " exceeds debtCeiling " + debtCeiling);
        }
        this.minCollateralizationRatio = minCollateralizationRatio;
        this.liquidationRatio = liquidationRatio;
        this.liquidationPenaltyBps = liquidationPenaltyBps;
        this.stabilityFeeBps = stabilityFeeBps;
        this.debtCeiling = debtCeiling;
        this.debtFloor = debtFloor;
    }
}
