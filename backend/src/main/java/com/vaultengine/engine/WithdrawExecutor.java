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
 * Removes collateral while keeping minimum ratio + safety buffer. Withdrawing the last collateral of a CDP
 * without debt closes it.
 */
@Component
public class WithdrawExecutor extends AbstractOperationExecutor {

    public WithdrawExecutor(CdpValidator validator, HealthCalculator healthCalculator, CdpStateResolver stateResolver) {
        super(validator, healthCalculator, stateResolver);
    }

    @Override
    public OperationType type() {
        return OperationType.WITHDRAW;
    }

    @Override
    protected OperationOutcome apply(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger price = context.getCollateralPrice();
        BigInteger newCollateral = cdp.getCollateralAmount().subtract(operation.amount());
        HealthFactor previous = healthCalculator.healthFactor(cdp, price);
        HealthFactor next = healthCalculator.healthFactor(
                newCollateral, cdp.getDebtAmount(), price, cdp.getConfig().getLiquidationRatio());

        CdpState newState = newCollateral.signum() == 0 && !cdp.hasDebt()
                ? CdpState.closed(operation.timestamp())
                : stateResolver.resolve(newCollateral, cdp.getDebtAmount(), next, cdp.getConfig());
        Cdp updated = cdp.transition(newCollateral, cdp.getDebtAmount(), newState, operation.timestamp());

        return OperationOutcome.builder()
                .operationType(OperationType.WITHDRAW)
                .updatedCdp(updated)
                .amount(operation.amount())
                .previousHealthFactor(previous)
                .newHealthFactor(next)
                .remainingAvailableCollateral(
                        healthCalculator.maxWithdrawable(updated, price, context.getSafetyBufferBps()))
                .build();
    }
}
