package com.vaultengine.engine;

import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.HealthFactor;
import com.vaultengine.domain.OperationType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only quotes on a CDP for dashboards and pre-trade checks. Nothing here changes a CDP or validates
 * authorization; execute through {@link CdpEngine} for that.
 */
@Service
@RequiredArgsConstructor
public class PositionAnalytics {

    private final HealthCalculator healthCalculator;

    public BigInteger maxWithdrawable(Cdp cdp, BigInteger price, int safetyBufferBps) {
        return healthCalculator.maxWithdrawable(cdp, price, safetyBufferBps);
    }

    public BigInteger maxMintable(Cdp cdp, BigInteger price, int safetyBufferBps) {
        return healthCalculator.maxMintable(cdp, price, safetyBufferBps);
    }

    /**
     * Health factor now versus after {@code amount} of {@code type}. Amounts larger than what the CDP holds are
     * clamped at zero for WITHDRAW and BURN.
     */
    public HealthImpact previewHealthImpact(Cdp cdp, OperationType type, BigInteger amount, BigInteger price) {
        BigInteger collateral = cdp.getCollateralAmount();
        BigInteger debt = cdp.getDebtAmount();
        switch (type) {
            case DEPOSIT -> collateral = collateral.add(amount);
            case WITHDRAW -> collateral = collateral.subtract(amount).max(BigInteger.ZERO);
            case MINT -> debt = debt.add(amount);
            case BURN -> debt = debt.subtract(amount).max(BigInteger.ZERO);
        }
        HealthFactor current = healthCalculator.healthFactor(cdp, price);
        HealthFactor projected = healthCalculator.healthFactor(
                collateral, debt, price, cdp.getConfig().getLiquidationRatio());
        return HealthImpact.between(current, projected);
    }

    /**
     * Stablecoin value released by withdrawing {@code amount} collateral.
     */
    public BigInteger freedCollateralValue(BigInteger amount, BigInteger price) {
        return healthCalculator.collateralValue(amount, price);
    }

    /**
     * Stability fee accrued since the CDP's last update and not yet recorded in its accrued fees.
     */
    public BigInteger pendingStabilityFee(Cdp cdp, Instant currentTime) {
        return cdp.pendingStabilityFee(currentTime);
    }

    /**
     * Stablecoin needed to settle everything: debt, recorded fees and fees pending since the last update.
     */
    public BigInteger fullClosureAmount(Cdp cdp, Instant currentTime) {
        return cdp.getDebtAmount().add(cdp.getAccruedFees()).add(pendingStabilityFee(cdp, currentTime));
    }

    /**
     * Smallest burn that lifts the health factor to at least {@code target}; zero when already there,
     * the whole debt for an unbounded target.
     */
    public BigInteger minRepayForHealthFactor(Cdp cdp, BigInteger price, HealthFactor target) {
        if (!cdp.hasDebt()) {
            return BigInteger.ZERO;
        }
        HealthFactor current = healthCalculator.healthFactor(cdp, price);
        if (current.compareTo(target) >= 0) {
            return BigInteger.ZERO;
        }
        if (target.isUnbounded()) {
            return cdp.getDebtAmount();
        }
        // largest debt D with adjustedValue / D >= target
        BigInteger maxDebt = current.getNumerator().multiply(target.getDenominator()).divide(target.getNumerator());
        return cdp.getDebtAmount().subtract(maxDebt).min(cdp.getDebtAmount());
    }
}
