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
 * Adds collateral. A deposit only improves solvency, so the CDP stays ACTIVE with the recomputed health factor.
 */
@Component
public class DepositExecutor extends AbstractOperationExecutor {

    public DepositExecutor(CdpValidator validator, HealthCalculator healthCalculator, CdpStateResolver stateResolver) {
        super(validator, healthCalculator, stateResolver);
    }

    @Override
    public OperationType type() {
        return OperationType.DEPOSIT;
    }

    @Override
    protected OperationOutcome apply(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger price = context.getCollateralPrice();
        BigInteger newCollateral = cdp.getCollateralAmount().add(operation.amount());
        HealthFactor previous = healthCalculator.healthFactor(cdp, price);
        HealthFactor next = healthCalculator.healthFactor(
                newCollateral, cdp.getDebtAmount(), price, cdp.getConfig().getLiquidationRatio());

        Cdp updated = cdp.transition(newCollateral, cdp.getDebtAmount(), CdpState.active(next), operation.timestamp());
        return OperationOutcome.builder()
                .operationType(OperationType.DEPOSIT)
                .updatedCdp(updated)
                .amount(operation.amount())
                .previousHealthFactor(previous)
                .newHealthFactor(next)
                .build();
    }
}
