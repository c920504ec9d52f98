package com.vaultengine.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CdpErrorTest {

    @Test
    @DisplayName("shutdown, authorization and state errors are not retryable")
    void nonRetryable() {
        assertThat(new CdpError.EmergencyShutdown().isRetryable()).isFalse();
        assertThat(new CdpError.Unauthorized("0xa", "0xb").isRetryable()).isFalse();
        assertThat(new CdpError.InvalidOperationForState("MINT", CdpStateType.LIQUIDATING).isRetryable()).isFalse();
    }

    @Test
    @DisplayName("ratio and limit errors are retryable")
    void retryable() {
        assertThat(new CdpError.BelowMinCollateralRatio(BigInteger.valueOf(15000), BigInteger.valueOf(15300))
                .isRetryable()).isTrue();
        assertThat(new CdpError.WithdrawalLimitExceeded(BigInteger.ONE, BigInteger.TWO).isRetryable()).isTrue();
        assertThat(new CdpError.DebtCeilingExceeded(BigInteger.ONE, BigInteger.TWO).isRetryable()).isTrue();
        assertThat(new CdpError.DebtFloorViolated(BigInteger.TWO, BigInteger.ONE).isRetryable()).isTrue();
        assertThat(new CdpError.BurnLimitExceeded(BigInteger.ONE, BigInteger.TWO).isRetryable()).isTrue();
    }

    @Test
    @DisplayName("messages carry the offending values")
    void messages() {
        CdpError error = new CdpError.BelowMinCollateralRatio(BigInteger.valueOf(15000), BigInteger.valueOf(15300));
        assertThat(error.code()).isEqualTo(CdpErrorCode.BELOW_MIN_COLLATERAL_RATIO);
        assertThat(error.message()).contains("15000").contains("15300");
        assertThat(new CdpError.Unauthorized("0xowner", "0xcaller").message())
                .contains("0xowner").contains("0xcaller");
        assertThat(new CdpError.InvalidOperationForState("WITHDRAW", CdpStateType.CLOSED).message())
                .isEqualTo("WITHDRAW is not allowed in state CLOSED");
    }

    @Test
    void valueEquality() {
        assertThat(new CdpError.InvalidAmount(BigInteger.ZERO)).isEqualTo(new CdpError.InvalidAmount(BigInteger.ZERO));
    }
}
