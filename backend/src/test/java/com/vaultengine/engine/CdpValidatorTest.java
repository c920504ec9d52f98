package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.CdpState;
import com.vaultengine.domain.CdpStateType;
import com.vaultengine.domain.OperationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.vaultengine.engine.EngineFixtures.OWNER;
import static com.vaultengine.engine.EngineFixtures.PRICE;
import static com.vaultengine.engine.EngineFixtures.STRANGER;
import static com.vaultengine.engine.EngineFixtures.T1;
import static com.vaultengine.engine.EngineFixtures.context;
import static com.vaultengine.engine.EngineFixtures.contextBuilder;
import static com.vaultengine.engine.EngineFixtures.referenceCdp;
import static com.vaultengine.engine.EngineFixtures.units;
import static org.assertj.core.api.Assertions.assertThat;

class CdpValidatorTest {

    private final CdpValidator validator = new CdpValidator(new HealthCalculator());

    private static Cdp liquidating() {
        return referenceCdp().toBuilder().state(CdpState.liquidating(units(1300))).build();
    }

    @Nested
    @DisplayName("shared checks run in order: shutdown, owner, amount, state")
    class SharedOrder {
        @Test
        void shutdownWinsOverEverything() {
            OperationContext halted = contextBuilder(PRICE).emergencyShutdown(true).build();
            CdpOperation bad = CdpOperation.withdraw(BigInteger.ZERO, STRANGER, T1);

            Result<Void, CdpError> result = validator.validate(liquidating(), bad, halted);

            assertThat(result.getError()).isEqualTo(new CdpError.EmergencyShutdown());
        }

        @Test
        void ownerCheckedBeforeAmount() {
            CdpOperation bad = CdpOperation.deposit(BigInteger.ZERO, STRANGER, T1);

            assertThat(validator.validate(referenceCdp(), bad, context()).getError())
                    .isEqualTo(new CdpError.Unauthorized(OWNER, STRANGER));
        }

        @Test
        void amountCheckedBeforeState() {
            CdpOperation bad = CdpOperation.mint(BigInteger.valueOf(-5), OWNER, T1);

            assertThat(validator.validate(liquidating(), bad, context()).getError())
                    .isEqualTo(new CdpError.InvalidAmount(BigInteger.valueOf(-5)));
        }

        @Test
        void rejectsNonActiveState() {
            Cdp closed = referenceCdp().toBuilder().state(CdpState.closed(T1)).build();

            assertThat(validator.validate(closed, CdpOperation.deposit(units(1), OWNER, T1), context()).getError())
                    .isEqualTo(new CdpError.InvalidOperationForState("DEPOSIT", CdpStateType.CLOSED));
            assertThat(validator.validate(liquidating(), CdpOperation.burn(units(1), OWNER, T1), context()).getError())
                    .isEqualTo(new CdpError.InvalidOperationForState("BURN", CdpStateType.LIQUIDATING));
        }
    }

    @Nested
    @DisplayName("withdraw")
    class Withdraw {
        @Test
        void availabilityCheckedBeforeLimit() {
            OperationContext tight = contextBuilder(PRICE).maxWithdrawAmount(units(1)).build();

            assertThat(validator.validateWithdraw(referenceCdp(), CdpOperation.withdraw(units(3), OWNER, T1), tight)
                    .getError())
                    .isEqualTo(new CdpError.InsufficientAvailableCollateral(units(2), units(3)));
        }

        @Test
        void limit() {
            OperationContext tight = contextBuilder(PRICE).maxWithdrawAmount(BigInteger.TEN).build();

            assertThat(validator.validateWithdraw(referenceCdp(), CdpOperation.withdraw(BigInteger.valueOf(11), OWNER, T1),
                    tight).getError())
                    .isEqualTo(new CdpError.WithdrawalLimitExceeded(BigInteger.TEN, BigInteger.valueOf(11)));
        }

        @Test
        void ratioIncludesBuffer() {
            CdpOperation half = CdpOperation.withdraw(new BigInteger("500000000000000000"), OWNER, T1);

            assertThat(validator.validate(referenceCdp(), half, context()).getError())
                    .isEqualTo(new CdpError.BelowMinCollateralRatio(BigInteger.valueOf(15000), BigInteger.valueOf(15300)));
        }
    }

    @Nested
    @DisplayName("mint")
    class Mint {
        @Test
        void limitCheckedFirst() {
            OperationContext capped = contextBuilder(PRICE).maxMintAmount(units(10)).build();

            assertThat(validator.validate(referenceCdp(), CdpOperation.mint(units(11), OWNER, T1), capped).getError())
                    .isEqualTo(new CdpError.MintLimitExceeded(units(10), units(11)));
        }

        @Test
        void ceiling() {
            assertThat(validator.validate(referenceCdp(), CdpOperation.mint(units(999_000), OWNER, T1), context())
                    .getError())
                    .isEqualTo(new CdpError.DebtCeilingExceeded(units(1_000_000), units(1_001_000)));
        }

        @Test
        @DisplayName("system-wide ceiling counts the debt of every CDP")
        void globalCeiling() {
            CdpOperation mint = CdpOperation.mint(units(500), OWNER, T1);
            OperationContext nearlyFull = contextBuilder(PRICE)
                    .globalDebtCeiling(units(5000)).currentTotalDebt(units(4600)).build();
            OperationContext roomLeft = contextBuilder(PRICE)
                    .globalDebtCeiling(units(5000)).currentTotalDebt(units(4500)).build();

            assertThat(validator.validate(referenceCdp(), mint, nearlyFull).getError())
                    .isEqualTo(new CdpError.DebtCeilingExceeded(units(5000), units(5100)));
            assertThat(validator.validate(referenceCdp(), mint, roomLeft).isOk()).isTrue();
        }

        @Test
        void globalCeilingCheckedBeforeFloor() {
            Cdp empty = EngineFixtures.cdp(units(10), BigInteger.ZERO);
            OperationContext tight = contextBuilder(PRICE).globalDebtCeiling(units(10)).build();

            assertThat(validator.validate(empty, CdpOperation.mint(units(50), OWNER, T1), tight).getError())
                    .isEqualTo(new CdpError.DebtCeilingExceeded(units(10), units(50)));
        }

        @Test
        void floorOnFreshPosition() {
            Cdp empty = EngineFixtures.cdp(units(10), BigInteger.ZERO);

            assertThat(validator.validate(empty, CdpOperation.mint(units(50), OWNER, T1), context()).getError())
                    .isEqualTo(new CdpError.DebtFloorViolated(units(100), units(50)));
        }

        @Test
        void ratio() {
            assertThat(validator.validate(referenceCdp(), CdpOperation.mint(units(700), OWNER, T1), context())
                    .getError())
                    .isInstanceOf(CdpError.BelowMinCollateralRatio.class);
        }
    }

    @Nested
    @DisplayName("burn")
    class Burn {
        @Test
        void moreThanDebtIsInvalidAmount() {
            assertThat(validator.validateBurn(referenceCdp(), CdpOperation.burn(units(2001), OWNER, T1), context())
                    .getError())
                    .isEqualTo(new CdpError.InvalidAmount(units(2001)));
        }

        @Test
        void dustRemainderViolatesFloor() {
            assertThat(validator.validateBurn(referenceCdp(), CdpOperation.burn(units(1950), OWNER, T1), context())
                    .getError())
                    .isEqualTo(new CdpError.DebtFloorViolated(units(100), units(50)));
        }

        @Test
        void fullRepaymentIsAllowed() {
            assertThat(validator.validateBurn(referenceCdp(), CdpOperation.burn(units(2000), OWNER, T1), context())
                    .isOk()).isTrue();
        }

        @Test
        @DisplayName("burn cap is checked before the debt comparison")
        void limitCheckedFirst() {
            OperationContext capped = contextBuilder(PRICE).maxBurnAmount(units(500)).build();

            assertThat(validator.validate(referenceCdp(), CdpOperation.burn(units(600), OWNER, T1), capped).getError())
                    .isEqualTo(new CdpError.BurnLimitExceeded(units(500), units(600)));
            assertThat(validator.validate(referenceCdp(), CdpOperation.burn(units(2001), OWNER, T1), capped).getError())
                    .isEqualTo(new CdpError.BurnLimitExceeded(units(500), units(2001)));
            assertThat(validator.validate(referenceCdp(), CdpOperation.burn(units(500), OWNER, T1), capped).isOk())
                    .isTrue();
        }
    }

    @Test
    @DisplayName("deposit over the configured cap is rejected")
    void depositLimit() {
        OperationContext capped = contextBuilder(PRICE).maxDepositAmount(units(5)).build();

        assertThat(validator.validate(referenceCdp(), CdpOperation.deposit(units(6), OWNER, T1), capped).getError())
                .isEqualTo(new CdpError.DepositLimitExceeded(units(5), units(6)));
        assertThat(validator.validate(referenceCdp(), CdpOperation.deposit(units(5), OWNER, T1), capped).isOk())
                .isTrue();
    }
}
