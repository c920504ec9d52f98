package com.vaultengine.engine;

import com.vaultengine.domain.HealthFactor;

import java.math.BigInteger;

/**
 * Projected effect of an operation on the health factor, computed without executing it.
 *
 * @param current   health factor now
 * @param projected health factor after the operation
 * @param deltaBps  projected minus current, in bps; positive = improvement. Uses {@link HealthFactor#UNBOUNDED_BPS}
 *                  for a debt-free side, so it is zero when both sides are debt-free
 */
public record HealthImpact(HealthFactor current, HealthFactor projected, BigInteger deltaBps) {

    public static HealthImpact between(HealthFactor current, HealthFactor projected) {
        return new HealthImpact(current, projected, projected.toBps().subtract(current.toBps()));
    }

    public boolean isImprovement() {
        return projected.compareTo(current) > 0;
    }
}
