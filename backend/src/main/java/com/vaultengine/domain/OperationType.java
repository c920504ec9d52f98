package com.vaultengine.domain;

/**
 * Owner-initiated CDP operations.
 */
public enum OperationType {
    /** Add collateral. */
    DEPOSIT,
    /** Remove collateral. */
    WITHDRAW,
    /** Issue stablecoin debt. */
    MINT,
    /** Repay stablecoin debt. */
    BURN
}
