package com.vaultengine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.CdpStateType;
import com.vaultengine.engine.EngineFixtures;
import com.vaultengine.engine.OperationOutcome;
import com.vaultengine.position.CdpOperationService;
import com.vaultengine.position.CdpStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.vaultengine.engine.EngineFixtures.OWNER;
import static com.vaultengine.engine.EngineFixtures.T1;
import static com.vaultengine.engine.EngineFixtures.tenths;
import static com.vaultengine.engine.EngineFixtures.units;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class VaultEngineApplicationTest {

    @Autowired
    CdpOperationService service;

    @Autowired
    CdpStore cdpStore;

    @Test
    @DisplayName("full cycle against application.yml: open, batch, withdraw, repay, close")
    void fullCycle() {
        Cdp cdp = EngineFixtures.cdp(units(2), units(2000)).toBuilder().id("app-cdp").build();
        service.open(cdp);

        Result<OperationOutcome, CdpError> tooMuch =
                service.execute("app-cdp", CdpOperation.withdraw(tenths(5), OWNER, T1));
        assertThat(tooMuch.getError()).isInstanceOf(CdpError.BelowMinCollateralRatio.class);

        assertThat(service.execute("app-cdp", CdpOperation.withdraw(tenths(1), OWNER, T1)).isOk()).isTrue();
        assertThat(service.executeBatch("app-cdp", List.of(
                CdpOperation.burn(units(2000), OWNER, T1),
                CdpOperation.withdraw(tenths(19), OWNER, T1))).isOk()).isTrue();

        Cdp stored = cdpStore.findById("app-cdp").orElseThrow();
        assertThat(stored.getStateType()).isEqualTo(CdpStateType.CLOSED);
        assertThat(stored.getVersion()).isEqualTo(3);
        assertThat(service.close("app-cdp").isErr()).isTrue();
    }
}
