package com.vaultengine.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle state of a CDP with its associated data.
 * Allowed transitions: ACTIVE to LIQUIDATING (health factor &lt;= 1.0), ACTIVE or LIQUIDATING to CLOSED (terminal).
 */
public sealed interface CdpState permits CdpState.Active, CdpState.Liquidating, CdpState.Closed {

    CdpStateType type();

    static CdpState active(HealthFactor healthFactor) {
        return new Active(healthFactor);
    }

    static CdpState liquidating(BigInteger liquidationPrice) {
        return new Liquidating(liquidationPrice);
    }

    static CdpState closed(Instant closedAt) {
        return new Closed(closedAt);
    }

    record Active(HealthFactor healthFactor) implements CdpState {
        public Active {
            Objects.requireNonNull(healthFactor, "healthFactor must not be null");
        }

        @Override
        public CdpStateType type() {
            return CdpStateType.ACTIVE;
        }
    }

    /**
     * @param liquidationPrice collateral price (18 decimals) at which health factor equals 1.0
     */
    record Liquidating(BigInteger liquidationPrice) implements CdpState {
        public Liquidating {
            Objects.requireNonNull(liquidationPrice, "liquidationPrice must not be null");
        }

        @Override
        public CdpStateType type() {
            return CdpStateType.LIQUIDATING;
        }
    }

    record Closed(Instant closedAt) implements CdpState {
        public Closed {
            Objects.requireNonNull(closedAt, "closedAt must not be null");
        }

        @Override
        public CdpStateType type() {
            return CdpStateType.CLOSED;
        }
    }
}
