package com.vaultengine.domain;

import java.util.Objects;

/**
 * A CDP snapshot paired with the operation to apply to it. Unit of a multi-CDP batch.
 */
public record OperationRequest(Cdp cdp, CdpOperation operation) {

    public OperationRequest {
        Objects.requireNonNull(cdp, "cdp must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
    }
}
