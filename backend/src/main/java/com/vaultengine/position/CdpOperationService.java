package com.vaultengine.position;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.CdpState;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.engine.BatchExecutor;
import com.vaultengine.engine.CdpEngine;
import com.vaultengine.engine.OperationOutcome;
import com.vaultengine.engine.PositionAnalytics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Load, price, execute, commit, publish. Validation failures come back as {@code Result.err} and leave the
 * store untouched; missing CDPs, missing prices and lost write races are thrown as {@link CdpServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CdpOperationService {

    private final CdpStore cdpStore;
    private final CollateralPriceOracle priceOracle;
    private final CdpEngine engine;
    private final BatchExecutor batchExecutor;
    private final PositionAnalytics analytics;
    private final OperationContextFactory contextFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void open(Cdp cdp) {
        cdpStore.insert(cdp);
        log.info("Opened CDP {} owner={} collateralType={}", cdp.getId(), cdp.getOwner(), cdp.getCollateralType());
    }

    public Result<OperationOutcome, CdpError> execute(String cdpId, CdpOperation operation) {
        Cdp cdp = load(cdpId);
        OperationContext context = contextFactory.create(price(cdp), systemDebt());
        Result<OperationOutcome, CdpError> result = engine.execute(cdp, operation, context);
        if (result.isOk()) {
            commit(cdp, result.getValue().getUpdatedCdp());
        }
        return result;
    }

    /**
     * Applies all operations to one CDP and commits only the final CDP, once. Any rejected operation leaves the
     * stored CDP as it was.
     */
    public Result<List<OperationOutcome>, CdpError> executeBatch(String cdpId, List<CdpOperation> operations) {
        Cdp cdp = load(cdpId);
        OperationContext context = contextFactory.create(price(cdp), systemDebt());
        Result<List<OperationOutcome>, CdpError> result = batchExecutor.applyBatch(cdp, operations, context);
        if (result.isOk() && !result.getValue().isEmpty()) {
            List<OperationOutcome> outcomes = result.getValue();
            commit(cdp, outcomes.get(outcomes.size() - 1).getUpdatedCdp());
        }
        return result;
    }

    /**
     * Settlement close. Works under emergency shutdown; rejected only for a CDP that is already closed.
     */
    public Result<Cdp, CdpError> close(String cdpId) {
        Cdp cdp = load(cdpId);
        Result<Cdp, CdpError> result = engine.close(cdp, clock.instant());
        if (result.isOk()) {
            commit(cdp, result.getValue());
        }
        return result;
    }

    public BigInteger quoteMaxWithdrawable(String cdpId) {
        Cdp cdp = load(cdpId);
        return analytics.maxWithdrawable(cdp, price(cdp), contextFactory.safetyBufferBps());
    }

    public BigInteger quoteMaxMintable(String cdpId) {
        Cdp cdp = load(cdpId);
        return analytics.maxMintable(cdp, price(cdp), contextFactory.safetyBufferBps());
    }

    private Cdp load(String cdpId) {
        return cdpStore.findById(cdpId)
                .orElseThrow(() -> new CdpServiceException(CdpServiceException.CDP_NOT_FOUND,
                        "CDP not found: " + cdpId));
    }

    private BigInteger price(Cdp cdp) {
        return priceOracle.currentPrice(cdp.getCollateralType())
                .orElseThrow(() -> new CdpServiceException(CdpServiceException.PRICE_UNAVAILABLE,
                        "No price for collateral " + cdp.getCollateralType() + " (CDP " + cdp.getId() + ")"));
    }

    private BigInteger systemDebt() {
        return contextFactory.hasGlobalDebtCeiling() ? cdpStore.totalDebt() : BigInteger.ZERO;
    }

    private void commit(Cdp loaded, Cdp updated) {
        if (!cdpStore.compareAndSet(loaded.getVersion(), updated)) {
            log.warn("CDP {} changed concurrently; version {} is stale", loaded.getId(), loaded.getVersion());
            throw new CdpServiceException(CdpServiceException.CONCURRENT_MODIFICATION,
                    "CDP " + loaded.getId() + " was modified concurrently (expected version " + loaded.getVersion() + ")");
        }
        log.info("Committed CDP {} version={} state={} collateral={} debt={}", updated.getId(), updated.getVersion(),
                updated.getStateType(), updated.getCollateralAmount(), updated.getDebtAmount());
        if (updated.getState() instanceof CdpState.Liquidating liquidating) {
            eventPublisher.publishEvent(new CdpLiquidationSignalEvent(this, updated.getId(),
                    updated.getCollateralType(), liquidating.liquidationPrice(), updated.getVersion()));
        }
    }
}
