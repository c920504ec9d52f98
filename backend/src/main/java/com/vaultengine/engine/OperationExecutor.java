package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.OperationContext;
import com.vaultengine.domain.OperationType;

/**
 * Executes one operation type. Implementations are pure: the input CDP is never modified and the same inputs
 * always give the same result.
 */
public interface OperationExecutor {

    OperationType type();

    Result<OperationOutcome, CdpError> execute(Cdp cdp, CdpOperation operation, OperationContext context);
}
