package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.domain.OperationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the state-transition engine. Routes each operation to its executor and returns the outcome
 * or the first validation error. Stateless: safe to call from any number of threads. Committing the returned
 * CDP, serialized per CDP id, is the caller's job.
 */
@Service
@Slf4j
public class CdpEngine {

    private final Map<OperationType, OperationExecutor> executors;
    private final CdpStateResolver stateResolver;

    public CdpEngine(List<OperationExecutor> executors, CdpStateResolver stateResolver) {
        Map<OperationType, OperationExecutor> byType = new EnumMap<>(OperationType.class);
        for (OperationExecutor executor : executors) {
            OperationExecutor previous = byType.put(executor.type(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate executor for " + executor.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        for (OperationType type : OperationType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("No executor registered for " + type);
            }
        }
        this.executors = byType;
        this.stateResolver = stateResolver;
    }

    public Result<OperationOutcome, CdpError> execute(Cdp cdp, CdpOperation operation, OperationContext context) {
        Result<OperationOutcome, CdpError> result = executors.get(operation.type()).execute(cdp, operation, context);
        if (result.isErr()) {
            log.debug("CDP {} {} {} rejected: {}", cdp.getId(), operation.type(), operation.amount(),
                    result.getError().message());
        } else {
            OperationOutcome outcome = result.getValue();
            log.debug("CDP {} {} {} applied: state {} health {} -> {}", cdp.getId(), operation.type(),
                    operation.amount(), outcome.getUpdatedCdp().getStateType(),
                    outcome.getPreviousHealthFactor(), outcome.getNewHealthFactor());
        }
        return result;
    }

    /**
     * Terminal close for external liquidation or settlement. Not gated by emergency shutdown.
     */
    public Result<Cdp, CdpError> close(Cdp cdp, Instant at) {
        Result<Cdp, CdpError> result = stateResolver.close(cdp, at);
        if (result.isErr()) {
            log.debug("CDP {} close rejected: {}", cdp.getId(), result.getError().message());
        }
        return result;
    }
}
