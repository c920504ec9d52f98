package com.vaultengine.position;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigInteger;

/**
 * Published after a commit leaves a CDP LIQUIDATING. The liquidation service consumes it and seizes collateral
 * on its own; it never calls back into the engine to do so.
 */
@Getter
public class CdpLiquidationSignalEvent extends ApplicationEvent {

    private final String cdpId;
    private final String collateralType;
    private final BigInteger liquidationPrice;
    private final long version;

    public CdpLiquidationSignalEvent(Object source, String cdpId, String collateralType, BigInteger liquidationPrice,
                                     long version) {
        super(source);
        this.cdpId = cdpId;
        this.collateralType = collateralType;
        this.liquidationPrice = liquidationPrice;
        this.version = version;
    }
}
