package com.vaultengine.position;

import com.vaultengine.common.FixedPointMath;
import com.vaultengine.config.OracleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CollateralPriceOracle} backed by vaultengine.oracle.prices. Prices are scaled to 18 decimals once, at
 * startup; non-positive entries are skipped with a warning.
 */
@Component
@Slf4j
public class ConfiguredPriceOracle implements CollateralPriceOracle {

    private final Map<String, BigInteger> prices;

    public ConfiguredPriceOracle(OracleProperties properties) {
        Map<String, BigInteger> scaled = new HashMap<>();
        for (Map.Entry<String, BigDecimal> entry : properties.getPrices().entrySet()) {
            BigDecimal price = entry.getValue();
            if (price == null || price.signum() <= 0) {
                log.warn("Ignoring non-positive price {} for collateral {}", price, entry.getKey());
                continue;
            }
            scaled.put(normalize(entry.getKey()), FixedPointMath.fromDecimal(price));
        }
        this.prices = Map.copyOf(scaled);
        log.info("Configured oracle loaded {} collateral prices", prices.size());
    }

    @Override
    public Optional<BigInteger> currentPrice(String collateralType) {
        if (collateralType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(prices.get(normalize(collateralType)));
    }

    private static String normalize(String collateralType) {
        return collateralType.trim().toUpperCase(Locale.ROOT);
    }
}
