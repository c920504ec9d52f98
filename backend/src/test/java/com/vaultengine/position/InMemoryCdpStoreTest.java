package com.vaultengine.position;

import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpState;
import com.vaultengine.domain.HealthFactor;
import com.vaultengine.engine.EngineFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.vaultengine.engine.EngineFixtures.T1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCdpStoreTest {

    private final InMemoryCdpStore store = new InMemoryCdpStore();

    @Test
    @DisplayName("totalDebt sums the debt of every stored CDP")
    void totalDebt() {
        assertThat(store.totalDebt()).isZero();
        store.insert(EngineFixtures.referenceCdp());
        store.insert(EngineFixtures.referenceCdp().toBuilder().id("cdp-2").debtAmount(EngineFixtures.units(500)).build());

        assertThat(store.totalDebt()).isEqualTo(EngineFixtures.units(2500));
    }

    @Test
    @DisplayName("insert then findById; duplicate id is rejected")
    void insertAndFind() {
        Cdp cdp = EngineFixtures.referenceCdp();
        store.insert(cdp);

        assertThat(store.findById("cdp-1")).contains(cdp);
        assertThat(store.findById("missing")).isEmpty();
        assertThatThrownBy(() -> store.insert(cdp))
                .isInstanceOf(CdpServiceException.class)
                .satisfies(e -> assertThat(((CdpServiceException) e).getErrorCode())
                        .isEqualTo(CdpServiceException.DUPLICATE_CDP));
    }

    @Test
    @DisplayName("compareAndSet commits only against the expected version")
    void compareAndSet() {
        Cdp v0 = EngineFixtures.referenceCdp();
        store.insert(v0);
        Cdp v1 = v0.transition(BigInteger.TEN, v0.getDebtAmount(), CdpState.active(HealthFactor.ONE), T1);

        assertThat(store.compareAndSet(0, v1)).isTrue();
        assertThat(store.findById("cdp-1")).contains(v1);

        Cdp stale = v0.transition(BigInteger.ONE, v0.getDebtAmount(), CdpState.active(HealthFactor.ONE), T1);
        assertThat(store.compareAndSet(0, stale)).isFalse();
        assertThat(store.findById("cdp-1")).contains(v1);
    }

    @Test
    @DisplayName("compareAndSet on an unknown id does not create it")
    void unknownId() {
        Cdp cdp = EngineFixtures.referenceCdp();

        assertThat(store.compareAndSet(0, cdp)).isFalse();
        assertThat(store.findById(cdp.getId())).isEmpty();
    }

    @Test
    @DisplayName("of many writers racing on the same version exactly one wins")
    void singleWinnerUnderContention() throws Exception {
        Cdp v0 = EngineFixtures.referenceCdp();
        store.insert(v0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> writers = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                BigInteger collateral = BigInteger.valueOf(i + 1);
                writers.add(() -> store.compareAndSet(0,
                        v0.transition(collateral, v0.getDebtAmount(), v0.getState(), T1)));
            }
            int winners = 0;
            for (Future<Boolean> f : pool.invokeAll(writers)) {
                if (f.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.findById("cdp-1").orElseThrow().getVersion()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
