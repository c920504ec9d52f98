package com.vaultengine.engine;

import com.vaultengine.common.FixedPointMath;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.HealthFactor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.vaultengine.common.FixedPointMath.BPS_DENOMINATOR;
import static com.vaultengine.common.FixedPointMath.SCALE;

/**
 * Collateralization ratio, health factor and withdraw/mint headroom. All results round in the direction that
 * never over-reports collateral strength: ratios and health factors round down, required collateral rounds up.
 */
@Component
public class HealthCalculator {

    /** Ratio reported for a position without debt. */
    public static final BigInteger UNBOUNDED_RATIO_BPS = BigInteger.valueOf(Long.MAX_VALUE);

    /**
     * Collateral value in stablecoin units: collateral * price / 10^18.
     */
    public BigInteger collateralValue(BigInteger collateralAmount, BigInteger price) {
        return FixedPointMath.value(collateralAmount, price);
    }

    /**
     * (collateral * price / 10^18) * 10000 / debt, or {@link #UNBOUNDED_RATIO_BPS} when debt is zero.
     */
    public BigInteger collateralizationRatioBps(BigInteger collateralAmount, BigInteger debtAmount, BigInteger price) {
        if (debtAmount.signum() == 0) {
            return UNBOUNDED_RATIO_BPS;
        }
        return FixedPointMath.mulDiv(collateralValue(collateralAmount, price), BPS_DENOMINATOR, debtAmount);
    }

    public BigInteger collateralizationRatioBps(Cdp cdp, BigInteger price) {
        return collateralizationRatioBps(cdp.getCollateralAmount(), cdp.getDebtAmount(), price);
    }

    /**
     * (collateralValue * 10000 / liquidationRatio) / debt, exact; {@link HealthFactor#MAX} when debt is zero.
     */
    public HealthFactor healthFactor(BigInteger collateralAmount, BigInteger debtAmount, BigInteger price,
                                     int liquidationRatio) {
        if (debtAmount.signum() == 0) {
            return HealthFactor.MAX;
        }
        BigInteger adjusted = FixedPointMath.mulDiv(
                collateralValue(collateralAmount, price), BPS_DENOMINATOR, BigInteger.valueOf(liquidationRatio));
        return HealthFactor.of(adjusted, debtAmount);
    }

    public HealthFactor healthFactor(Cdp cdp, BigInteger price) {
        return healthFactor(cdp.getCollateralAmount(), cdp.getDebtAmount(), price, cdp.getConfig().getLiquidationRatio());
    }

    /**
     * Collateral price at which health factor reaches 1.0: debt * liquidationRatio / 10000 * 10^18 / collateral,
     * rounded up. Zero when there is no collateral or no debt.
     */
    public BigInteger liquidationPrice(BigInteger collateralAmount, BigInteger debtAmount, int liquidationRatio) {
        if (collateralAmount.signum() == 0 || debtAmount.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger thresholdValue = debtAmount.multiply(BigInteger.valueOf(liquidationRatio));
        return FixedPointMath.ceilDiv(thresholdValue.multiply(SCALE), BPS_DENOMINATOR.multiply(collateralAmount));
    }

    /**
     * Minimum ratio plus safety buffer, the bar for WITHDRAW and MINT.
     */
    public BigInteger requiredRatioBps(Cdp cdp, int safetyBufferBps) {
        return BigInteger.valueOf((long) cdp.getConfig().getMinCollateralizationRatio() + safetyBufferBps);
    }

    /**
     * Smallest collateral amount whose rounded-down ratio still meets {@code requiredRatioBps} for the given debt.
     */
    public BigInteger minimumCollateral(BigInteger debtAmount, BigInteger price, BigInteger requiredRatioBps) {
        if (debtAmount.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger requiredValue = FixedPointMath.mulDivUp(debtAmount, requiredRatioBps, BPS_DENOMINATOR);
        return FixedPointMath.mulDivUp(requiredValue, SCALE, price);
    }

    /**
     * Largest amount that can still be withdrawn while keeping minimum ratio + buffer. All collateral when
     * there is no debt; never negative.
     */
    public BigInteger maxWithdrawable(Cdp cdp, BigInteger price, int safetyBufferBps) {
        if (!cdp.hasDebt()) {
            return cdp.getCollateralAmount();
        }
        BigInteger minimum = minimumCollateral(cdp.getDebtAmount(), price, requiredRatioBps(cdp, safetyBufferBps));
        return cdp.getCollateralAmount().subtract(minimum).max(BigInteger.ZERO);
    }

    /**
     * Largest amount that can still be minted while keeping minimum ratio + buffer and the debt ceiling.
     * Zero when even that amount would leave debt under the floor.
     */
    public BigInteger maxMintable(Cdp cdp, BigInteger price, int safetyBufferBps) {
        BigInteger value = collateralValue(cdp.getCollateralAmount(), price);
        BigInteger maxDebtByRatio = FixedPointMath.mulDiv(value, BPS_DENOMINATOR, requiredRatioBps(cdp, safetyBufferBps));
        BigInteger maxDebt = maxDebtByRatio.min(cdp.getConfig().getDebtCeiling());
        BigInteger headroom = maxDebt.subtract(cdp.getDebtAmount());
        if (headroom.signum() <= 0 || maxDebt.compareTo(cdp.getConfig().getDebtFloor()) < 0) {
            return BigInteger.ZERO;
        }
        return headroom;
    }
}
