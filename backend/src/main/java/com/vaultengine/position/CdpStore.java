package com.vaultengine.position;

import com.vaultengine.domain.Cdp;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Persistence boundary for CDPs. Writes are serialized per CDP id through {@link #compareAndSet}: of two writers
 * that read the same version, only one commits.
 */
public interface CdpStore {

    Optional<Cdp> findById(String id);

    /**
     * Stores a new CDP.
     *
     * @throws CdpServiceException DUPLICATE_CDP if the id is taken
     */
    void insert(Cdp cdp);

    /**
     * Replaces the stored CDP with {@code updated} only if the stored version is still {@code expectedVersion}.
     *
     * @return true if committed, false if the CDP is missing or another writer got there first
     */
    boolean compareAndSet(long expectedVersion, Cdp updated);

    /**
     * Sum of the debt of every stored CDP.
     */
    BigInteger totalDebt();
}
