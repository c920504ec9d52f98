package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpConfig;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.OperationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Pre-conditions of every CDP operation. Shared checks run first, in fixed order, then the checks of the
 * requested operation. The first failing check is returned.
 */
@Component
@RequiredArgsConstructor
public class CdpValidator {

    private static final Result<Void, CdpError> VALID = Result.ok(null);

    private final HealthCalculator healthCalculator;

    public Result<Void, CdpError> validate(Cdp cdp, CdpOperation operation, OperationContext context) {
        Result<Void, CdpError> common = validateCommon(cdp, operation, context);
        if (common.isErr()) {
            return common;
        }
        return switch (operation.type()) {
            case DEPOSIT -> validateDeposit(operation, context);
            case WITHDRAW -> validateWithdraw(cdp, operation, context);
            case MINT -> validateMint(cdp, operation, context);
            case BURN -> validateBurn(cdp, operation, context);
        };
    }

    /**
     * Shutdown flag, owner, positive amount, ACTIVE state; in that order.
     */
    Result<Void, CdpError> validateCommon(Cdp cdp, CdpOperation operation, OperationContext context) {
        if (context.isEmergencyShutdown()) {
            return Result.err(new CdpError.EmergencyShutdown());
        }
        if (!cdp.getOwner().equals(operation.actor())) {
            return Result.err(new CdpError.Unauthorized(cdp.getOwner(), operation.actor()));
        }
        if (operation.amount().signum() <= 0) {
            return Result.err(new CdpError.InvalidAmount(operation.amount()));
        }
        return switch (cdp.getStateType()) {
            case ACTIVE -> VALID;
            case LIQUIDATING, CLOSED -> Result.err(
                    new CdpError.InvalidOperationForState(operation.type().name(), cdp.getStateType()));
        };
    }

    Result<Void, CdpError> validateDeposit(CdpOperation operation, OperationContext context) {
        Optional<BigInteger> limit = context.getMaxDepositAmount();
        if (limit.isPresent() && operation.amount().compareTo(limit.get()) > 0) {
            return Result.err(new CdpError.DepositLimitExceeded(limit.get(), operation.amount()));
        }
        return VALID;
    }

    Result<Void, CdpError> validateWithdraw(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger amount = operation.amount();
        if (amount.compareTo(cdp.getCollateralAmount()) > 0) {
            return Result.err(new CdpError.InsufficientAvailableCollateral(cdp.getCollateralAmount(), amount));
        }
        if (amount.compareTo(context.getMaxWithdrawAmount()) > 0) {
            return Result.err(new CdpError.WithdrawalLimitExceeded(context.getMaxWithdrawAmount(), amount));
        }
        return requireRatio(cdp, cdp.getCollateralAmount().subtract(amount), cdp.getDebtAmount(), context);
    }

    Result<Void, CdpError> validateMint(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger amount = operation.amount();
        Optional<BigInteger> limit = context.getMaxMintAmount();
        if (limit.isPresent() && amount.compareTo(limit.get()) > 0) {
            return Result.err(new CdpError.MintLimitExceeded(limit.get(), amount));
        }
        CdpConfig config = cdp.getConfig();
        BigInteger newDebt = cdp.getDebtAmount().add(amount);
        if (newDebt.compareTo(config.getDebtCeiling()) > 0) {
            return Result.err(new CdpError.DebtCeilingExceeded(config.getDebtCeiling(), newDebt));
        }
        Optional<BigInteger> globalCeiling = context.getGlobalDebtCeiling();
        if (globalCeiling.isPresent()) {
            BigInteger newTotalDebt = context.getCurrentTotalDebt().add(amount);
            if (newTotalDebt.compareTo(globalCeiling.get()) > 0) {
                return Result.err(new CdpError.DebtCeilingExceeded(globalCeiling.get(), newTotalDebt));
            }
        }
        if (newDebt.compareTo(config.getDebtFloor()) < 0) {
            return Result.err(new CdpError.DebtFloorViolated(config.getDebtFloor(), newDebt));
        }
        return requireRatio(cdp, cdp.getCollateralAmount(), newDebt, context);
    }

    Result<Void, CdpError> validateBurn(Cdp cdp, CdpOperation operation, OperationContext context) {
        BigInteger amount = operation.amount();
        Optional<BigInteger> limit = context.getMaxBurnAmount();
        if (limit.isPresent() && amount.compareTo(limit.get()) > 0) {
            return Result.err(new CdpError.BurnLimitExceeded(limit.get(), amount));
        }
        if (amount.compareTo(cdp.getDebtAmount()) > 0) {
            return Result.err(new CdpError.InvalidAmount(amount));
        }
        BigInteger remainder = cdp.getDebtAmount().subtract(amount);
        BigInteger floor = cdp.getConfig().getDebtFloor();
        if (remainder.signum() > 0 && remainder.compareTo(floor) < 0) {
            return Result.err(new CdpError.DebtFloorViolated(floor, remainder));
        }
        return VALID;
    }

    private Result<Void, CdpError> requireRatio(Cdp cdp, BigInteger collateralAmount, BigInteger debtAmount,
                                               OperationContext context) {
        BigInteger required = healthCalculator.requiredRatioBps(cdp, context.getSafetyBufferBps());
        BigInteger ratio = healthCalculator.collateralizationRatioBps(
                collateralAmount, debtAmount, context.getCollateralPrice());
        if (ratio.compareTo(required) < 0) {
            return Result.err(new CdpError.BelowMinCollateralRatio(ratio, required));
        }
        return VALID;
    }
}
