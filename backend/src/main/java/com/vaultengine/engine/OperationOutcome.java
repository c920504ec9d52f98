package com.vaultengine.engine;

import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.HealthFactor;
import com.vaultengine.domain.OperationType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Successful result of one operation: the replacement CDP plus metrics. The amount is what was deposited,
 * withdrawn, minted or burned.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class OperationOutcome {

    private final OperationType operationType;
    private final Cdp updatedCdp;
    private final BigInteger amount;
    private final HealthFactor previousHealthFactor;
    private final HealthFactor newHealthFactor;
    /** WITHDRAW only: what can still be withdrawn from the updated CDP at the same price and buffer. */
    private final BigInteger remainingAvailableCollateral;

    @Builder
    private OperationOutcome(OperationType operationType, Cdp updatedCdp, BigInteger amount,
                             HealthFactor previousHealthFactor, HealthFactor newHealthFactor,
                             BigInteger remainingAvailableCollateral) {
        this.operationType = Objects.requireNonNull(operationType, "operationType must not be null");
        this.updatedCdp = Objects.requireNonNull(updatedCdp, "updatedCdp must not be null");
        this.amount = Objects.requireNonNull(amount, "amount must not be null");
        this.previousHealthFactor = Objects.requireNonNull(previousHealthFactor, "previousHealthFactor must not be null");
        this.newHealthFactor = Objects.requireNonNull(newHealthFactor, "newHealthFactor must not be null");
        this.remainingAvailableCollateral = remainingAvailableCollateral;
    }

    public Optional<BigInteger> getRemainingAvailableCollateral() {
        return Optional.ofNullable(remainingAvailableCollateral);
    }
}
