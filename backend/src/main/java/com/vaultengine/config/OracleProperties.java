package com.vaultengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Static collateral prices for the configured oracle. Documented in application.yml under vaultengine.oracle.
 */
@ConfigurationProperties(prefix = "vaultengine.oracle")
@Getter
@Setter
public class OracleProperties {

    /**
     * Map: collateral type (case-insensitive, e.g. "ETH") -> price in stablecoin whole units (e.g. 2000.50).
     * Types without an entry have no price and operations on them fail with PRICE_UNAVAILABLE.
     */
    private Map<String, BigDecimal> prices = new HashMap<>();
}
