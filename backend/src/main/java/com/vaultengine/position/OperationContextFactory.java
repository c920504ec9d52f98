package com.vaultengine.position;

import com.vaultengine.common.FixedPointMath;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;

/**
 * Builds the per-call OperationContext from configured limits, a price and the injected clock. The only place
 * a wall clock is read; the engine itself never does.
 */
@Component
@RequiredArgsConstructor
public class OperationContextFactory {

    private final EngineProperties limits;
    private final Clock clock;

    public OperationContext create(BigInteger collateralPrice) {
        return create(collateralPrice, BigInteger.ZERO);
    }

    /**
     * @param currentTotalDebt debt outstanding across all CDPs, checked against the global debt ceiling
     */
    public OperationContext create(BigInteger collateralPrice, BigInteger currentTotalDebt) {
        return OperationContext.builder()
                .collateralPrice(collateralPrice)
                .maxWithdrawAmount(FixedPointMath.fromDecimal(limits.getMaxWithdrawAmount()))
                .safetyBufferBps(limits.getSafetyBufferBps())
                .emergencyShutdown(limits.isEmergencyShutdown())
                .currentTime(clock.instant())
                .maxDepositAmount(scaledOrNull(limits.getMaxDepositAmount()))
                .maxMintAmount(scaledOrNull(limits.getMaxMintAmount()))
                .maxBurnAmount(scaledOrNull(limits.getMaxBurnAmount()))
                .globalDebtCeiling(scaledOrNull(limits.getGlobalDebtCeiling()))
                .currentTotalDebt(currentTotalDebt)
                .build();
    }

    /** Whether a global debt ceiling is configured, so callers know to supply the system debt total. */
    public boolean hasGlobalDebtCeiling() {
        return limits.getGlobalDebtCeiling() != null;
    }

    public int safetyBufferBps() {
        return limits.getSafetyBufferBps();
    }

    private static BigInteger scaledOrNull(BigDecimal amount) {
        return amount != null ? FixedPointMath.fromDecimal(amount) : null;
    }
}
