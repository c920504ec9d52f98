package com.vaultengine.engine;

import com.vaultengine.common.Result;
import com.vaultengine.domain.Cdp;
import com.vaultengine.domain.CdpError;
import com.vaultengine.domain.CdpOperation;
import com.vaultengine.domain.OperationContext;
import lombok.RequiredArgsConstructor;

/**
 * Validate, then apply. Subclasses only compute the new quantities and state; they run after validation passed.
 */
@RequiredArgsConstructor
public abstract class AbstractOperationExecutor implements OperationExecutor {

    protected final CdpValidator validator;
    protected final HealthCalculator healthCalculator;
    protected final CdpStateResolver stateResolver;

    @Override
    public final Result<OperationOutcome, CdpError> execute(Cdp cdp, CdpOperation operation, OperationContext context) {
        if (operation.type() != type()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot execute " + operation.type());
        }
        Result<Void, CdpError> validation = validator.validate(cdp, operation, context);
        if (validation.isErr()) {
            return validation.castError();
        }
        return Result.ok(apply(cdp, operation, context));
    }

    protected abstract OperationOutcome apply(Cdp cdp, CdpOperation operation, OperationContext context);
}
