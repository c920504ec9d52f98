package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpConfig;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpState;
import com.vaultengine.domain.HealthFactor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Derives the next {@link CdpState}. Only ACTIVE CDPs reach the executors, so the rules here start from ACTIVE.
 */
@Component
@RequiredArgsConstructor
public class CdpStateResolver {

    public static final String CLOSE_OPERATION = "CLOSE";

    private final HealthCalculator healthCalculator;

    /**
     * State after a change to collateral or debt. Health factor &lt;= 1.0 flags the position for liquidation.
     * The 1.0 to 1.1 band stays ACTIVE: borderline but not liquidatable.
     */
    public CdpState resolve(BigInteger collateralAmount, BigInteger debtAmount, HealthFactor healthFactor,
                            CdpConfig config) {
        if (healthFactor.isLiquidatable()) {
            return CdpState.liquidating(
                    healthCalculator.liquidationPrice(collateralAmount, debtAmount, config.getLiquidationRatio()));
        }
        return CdpState.active(healthFactor);
    }

    /**
     * Terminal transition for external liquidation or settlement. ACTIVE and LIQUIDATING close; CLOSED is rejected.
     */
    public Result<Cdp, CdpError> close(Cdp cdp, Instant at) {
        return switch (cdp.getStateType()) {
            case ACTIVE, LIQUIDATING -> Result.ok(
                    cdp.transition(cdp.getCollateralAmount(), cdp.getDebtAmount(), CdpState.closed(at), at));
            case CLOSED -> Result.err(new CdpError.InvalidOperationForState(CLOSE_OPERATION, cdp.getStateType()));
        };
    }
}
