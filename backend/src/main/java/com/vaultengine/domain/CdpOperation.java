package com.vaultengine.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * One owner-initiated operation. The amount is not range-checked here; a non-positive amount is a validation
 * result (INVALID_AMOUNT), not a construction error.
 *
 * @param type      operation kind
 * @param amount    collateral units for DEPOSIT/WITHDRAW, stablecoin units for MINT/BURN (18 decimals)
 * @param actor     address initiating the operation
 * @param timestamp logical time of the operation; becomes the CDP's updatedAt
 */
public record CdpOperation(OperationType type, BigInteger amount, String actor, Instant timestamp) {

    public CdpOperation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static CdpOperation deposit(BigInteger amount, String depositor, Instant timestamp) {
        return new CdpOperation(OperationType.DEPOSIT, amount, depositor, timestamp);
    }

    public static CdpOperation withdraw(BigInteger amount, String withdrawer, Instant timestamp) {
        return new CdpOperation(OperationType.WITHDRAW, amount, withdrawer, timestamp);
    }

    public static CdpOperation mint(BigInteger amount, String minter, Instant timestamp) {
        return new CdpOperation(OperationType.MINT, amount, minter, timestamp);
    }

    public static CdpOperation burn(BigInteger amount, String burner, Instant timestamp) {
        return new CdpOperation(OperationType.BURN, amount, burner, timestamp);
    }
}
