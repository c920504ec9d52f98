package com.vaultengine.engine;

import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.HealthFactor;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.domain.OperationType;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Issues stablecoin debt against locked collateral.
 */
@Component
public class MintExecutor extends AbstractOperationExecutor {

    public MintExecutor(CdpValidator validator, HealthCalculator healthCalculator, CdpStateResolver stateResolver) {
        super(validator, healthCalculator, stateResolver);
    }

    @Override
    public OperationType type() {
        return OperationType.MINT;
    }

    @Override
    protected OperationOutcome apply(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger price = context.getCollateralPrice();
        BigInteger newDebt = cdp.getDebtAmount().add(operation.amount());
        HealthFactor previous = healthCalculator.healthFactor(cdp, price);
        HealthFactor next = healthCalculator.healthFactor(
                cdp.getCollateralAmount(), newDebt, price, cdp.getConfig().getLiquidationRatio());

        Cdp updated = cdp.transition(cdp.getCollateralAmount(), newDebt,
                stateResolver.resolve(cdp.getCollateralAmount(), newDebt, next, cdp.getConfig()),
                operation.timestamp());
        return OperationOutcome.builder()
                .operationType(OperationType.MINT)
                .updatedCdp(updated)
                .amount(operation.amount())
                .previousHealthFactor(previous)
                .newHealthFactor(next)
                .build();
    }
}
