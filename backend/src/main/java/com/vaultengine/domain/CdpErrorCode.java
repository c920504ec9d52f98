package com.vaultengine.domain;

/**
 * Codes of {@link CdpError}. Retryable errors may succeed when resubmitted with a different amount or after
 * the price moves; the others will not succeed without a change in protocol state or caller identity.
 */
public enum CdpErrorCode {
    EMERGENCY_SHUTDOWN(false),
    UNAUTHORIZED(false),
    INVALID_AMOUNT(true),
    INVALID_OPERATION_FOR_STATE(false),
    INSUFFICIENT_AVAILABLE_COLLATERAL(true),
    WITHDRAWAL_LIMIT_EXCEEDED(true),
    DEPOSIT_LIMIT_EXCEEDED(true),
    MINT_LIMIT_EXCEEDED(true),
    BURN_LIMIT_EXCEEDED(true),
    BELOW_MIN_COLLATERAL_RATIO(true),
    DEBT_CEILING_EXCEEDED(true),
    DEBT_FLOOR_VIOLATED(true);

    private final boolean retryable;

    CdpErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
