package com.vaultengine.domain;

/**
 * Discriminator of {@link CdpState}. Switch on this at every transition site.
 */
public enum CdpStateType {
    ACTIVE,
    LIQUIDATING,
    CLOSED
}
