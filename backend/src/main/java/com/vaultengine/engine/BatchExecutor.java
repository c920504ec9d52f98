package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.domain.OperationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies operations in order, all or nothing. The first failure aborts the batch and only that error is
 * returned; no partial outcome list escapes. Nothing is persisted here: the caller commits the whole outcome
 * list inside its own transaction boundary.
 * <p>
 * The context's system-wide debt total is carried through the batch: each operation sees the total left by the
 * operations before it, so a run of mints cannot overshoot the global debt ceiling together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchExecutor {

    private final CdpEngine engine;

    /**
     * Runs {@code operations} against one CDP, each against the CDP produced by the previous one.
     */
    public Result<List<OperationOutcome>, CdpError> applyBatch(Cdp cdp, List<CdpOperation> operations,
                                                               OperationContext context) {
        List<OperationOutcome> outcomes = new ArrayList<>(operations.size());
        Cdp current = cdp;
        OperationContext running = context;
        for (CdpOperation operation : operations) {
            Result<OperationOutcome, CdpError> result = engine.execute(current, operation, running);
            if (result.isErr()) {
                log.debug("Batch on CDP {} aborted after {} of {} operations", cdp.getId(), outcomes.size(),
                        operations.size());
                return result.castError();
            }
            outcomes.add(result.getValue());
            running = afterDebtChange(running, current, result.getValue().getUpdatedCdp());
            current = result.getValue().getUpdatedCdp();
        }
        return Result.ok(List.copyOf(outcomes));
    }

    /**
     * Runs requests that may target different CDPs. A request whose CDP was already updated earlier in the batch
     * runs against that updated CDP instead of its own (older) snapshot.
     */
    public Result<List<OperationOutcome>, CdpError> applyBatch(List<OperationRequest> requests,
                                                               OperationContext context) {
        List<OperationOutcome> outcomes = new ArrayList<>(requests.size());
        Map<String, Cdp> latest = new HashMap<>();
        OperationContext running = context;
        for (OperationRequest request : requests) {
            Cdp target = latest.getOrDefault(request.cdp().getId(), request.cdp());
            Result<OperationOutcome, CdpError> result = engine.execute(target, request.operation(), running);
            if (result.isErr()) {
                log.debug("Batch aborted after {} of {} requests at CDP {}", outcomes.size(), requests.size(),
                        target.getId());
                return result.castError();
            }
            Cdp updated = result.getValue().getUpdatedCdp();
            latest.put(updated.getId(), updated);
            outcomes.add(result.getValue());
            running = afterDebtChange(running, target, updated);
        }
        return Result.ok(List.copyOf(outcomes));
    }

    private static OperationContext afterDebtChange(OperationContext context, Cdp before, Cdp after) {
        BigInteger delta = after.getDebtAmount().subtract(before.getDebtAmount());
        if (delta.signum() == 0) {
            return context;
        }
        return context.withCurrentTotalDebt(context.getCurrentTotalDebt().add(delta).max(BigInteger.ZERO));
    }
}
