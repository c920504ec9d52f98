package com.vaultengine.position;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Source of collateral prices consumed by {@link CdpOperationService}. Sourcing and aggregation live behind this
 * interface; the engine only sees the resulting number.
 */
public interface CollateralPriceOracle {

    /**
     * Current price of one unit of {@code collateralType} in stablecoin, 18 decimals; empty if unknown.
     */
    Optional<BigInteger> currentPrice(String collateralType);
}
