package com.vaultengine.domain;

import java.math.BigInteger;

/**
 * Expected failure of a CDP operation, returned as a value. Amounts are 18-decimal integers, ratios in bps.
 */
public interface CdpError {

    CdpErrorCode code();

    String message();

    default boolean isRetryable() {
        return code().isRetryable();
    }

    /** Protocol-wide halt; nothing but settlement proceeds. */
    record EmergencyShutdown() implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.EMERGENCY_SHUTDOWN;
        }

        @Override
        public String message() {
            return "Protocol is in emergency shutdown";
        }
    }

    record Unauthorized(String owner, String caller) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.UNAUTHORIZED;
        }

        @Override
        public String message() {
            return "Caller " + caller + " is not the owner " + owner;
        }
    }

    record InvalidAmount(BigInteger amount) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.INVALID_AMOUNT;
        }

        @Override
        public String message() {
            return "Invalid amount: " + amount;
        }
    }

    record InvalidOperationForState(String operation, CdpStateType state) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.INVALID_OPERATION_FOR_STATE;
        }

        @Override
        public String message() {
            return operation + " is not allowed in state " + state;
        }
    }

    record InsufficientAvailableCollateral(BigInteger available, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.INSUFFICIENT_AVAILABLE_COLLATERAL;
        }

        @Override
        public String message() {
            return "Requested " + requested + " but only " + available + " collateral is locked";
        }
    }

    record WithdrawalLimitExceeded(BigInteger limit, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.WITHDRAWAL_LIMIT_EXCEEDED;
        }

        @Override
        public String message() {
            return "Withdrawal " + requested + " exceeds limit " + limit;
        }
    }

    record DepositLimitExceeded(BigInteger limit, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.DEPOSIT_LIMIT_EXCEEDED;
        }

        @Override
        public String message() {
            return "Deposit " + requested + " exceeds limit " + limit;
        }
    }

    record MintLimitExceeded(BigInteger limit, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.MINT_LIMIT_EXCEEDED;
        }

        @Override
        public String message() {
            return "Mint " + requested + " exceeds limit " + limit;
        }
    }

    record BurnLimitExceeded(BigInteger limit, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.BURN_LIMIT_EXCEEDED;
        }

        @Override
        public String message() {
            return "Burn " + requested + " exceeds limit " + limit;
        }
    }

    /**
     * @param current resulting ratio in bps
     * @param minimum required ratio in bps (minimum ratio plus safety buffer where one applies)
     */
    record BelowMinCollateralRatio(BigInteger current, BigInteger minimum) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.BELOW_MIN_COLLATERAL_RATIO;
        }

        @Override
        public String message() {
            return "Collateralization ratio " + current + " bps is below required " + minimum + " bps";
        }
    }

    /**
     * Raised for the CDP's own ceiling and for the system-wide one.
     *
     * @param requested total debt the operation would produce, for the CDP or for the whole system
     */
    record DebtCeilingExceeded(BigInteger ceiling, BigInteger requested) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.DEBT_CEILING_EXCEEDED;
        }

        @Override
        public String message() {
            return "Resulting debt " + requested + " exceeds ceiling " + ceiling;
        }
    }

    /**
     * @param remainder non-zero debt the operation would leave
     */
    record DebtFloorViolated(BigInteger floor, BigInteger remainder) implements CdpError {
        @Override
        public CdpErrorCode code() {
            return CdpErrorCode.DEBT_FLOOR_VIOLATED;
        }

        @Override
        public String message() {
            return "Resulting debt " + remainder + " is below floor " + floor + "; repay fully or stay above the floor";
        }
    }
}
