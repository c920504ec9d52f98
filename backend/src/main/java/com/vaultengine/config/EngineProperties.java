package com.vaultengine.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Protocol-wide operation limits that become each call's OperationContext. Documented in application.yml
 * under vaultengine.engine. Amounts are whole token units (e.g. 2.5), scaled to 18 decimals when the context
 * is built.
 */
@ConfigurationProperties(prefix = "vaultengine.engine")
@NoArgsConstructor
@Getter
@Setter
public class EngineProperties {

    /** Added to each CDP's minimum ratio for WITHDRAW and MINT. Default 300 (3%). */
    private int safetyBufferBps = 300;

    /** Largest single withdrawal, collateral units. Default 1,000,000. */
    private BigDecimal maxWithdrawAmount = new BigDecimal("1000000");

    /** Largest single deposit, collateral units. Unset = unlimited. */
    private BigDecimal maxDepositAmount;

    /** Largest single mint, stablecoin units. Unset = unlimited. */
    private BigDecimal maxMintAmount;

    /** Largest single burn, stablecoin units. Unset = unlimited. */
    private BigDecimal maxBurnAmount;

    /** Debt ceiling across all CDPs, stablecoin units. Unset = none. */
    private BigDecimal globalDebtCeiling;

    /** Halts all owner operations; closing for settlement still works. Default false. */
    private boolean emergencyShutdown = false;
}
