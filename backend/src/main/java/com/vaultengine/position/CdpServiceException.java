package com.vaultengine.position;

import lombok.Getter;

/**
 * Infrastructure failure around the engine: unknown CDP, no price, lost write race. Validation failures are
 * never thrown; they come back as {@code Result} errors.
 */
@Getter
public class CdpServiceException extends RuntimeException {

    public static final String CDP_NOT_FOUND = "CDP_NOT_FOUND";
    public static final String DUPLICATE_CDP = "DUPLICATE_CDP";
    public static final String PRICE_UNAVAILABLE = "PRICE_UNAVAILABLE";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";

    /** One of CDP_NOT_FOUND, DUPLICATE_CDP, PRICE_UNAVAILABLE, CONCURRENT_MODIFICATION. */
    private final String errorCode;

    public CdpServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
