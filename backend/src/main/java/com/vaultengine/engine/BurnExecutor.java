package com.vaultengine.engine;

import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.CdpState;
import com.vaultengine.domain.HealthFactor;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.domain.OperationType;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Repays stablecoin debt. Full repayment leaves an unencumbered ACTIVE CDP, not a closed one: closing also
 * needs the collateral withdrawn.
 */
@Component
public class BurnExecutor extends AbstractOperationExecutor {

    public BurnExecutor(CdpValidator validator, HealthCalculator healthCalculator, CdpStateResolver stateResolver) {
        super(validator, healthCalculator, stateResolver);
    }

    @Override
    public OperationType type() {
        return OperationType.BURN;
    }

    @Override
    protected OperationOutcome apply(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger price = context.getCollateralPrice();
        BigInteger newDebt = cdp.getDebtAmount().subtract(operation.amount());
        HealthFactor previous = healthCalculator.healthFactor(cdp, price);
        HealthFactor next = healthCalculator.healthFactor(
                cdp.getCollateralAmount(), newDebt, price, cdp.getConfig().getLiquidationRatio());

        CdpState newState = newDebt.signum() == 0
                ? CdpState.active(HealthFactor.MAX)
                : stateResolver.resolve(cdp.getCollateralAmount(), newDebt, next, cdp.getConfig());
        Cdp updated = cdp.transition(cdp.getCollateralAmount(), newDebt, newState, operation.timestamp());
        return OperationOutcome.builder()
                .operationType(OperationType.BURN)
                .updatedCdp(updated)
                .amount(operation.amount())
                .previousHealthFactor(previous)
                .newHealthFactor(next)
                .build();
    }
}
