package com.vaultengine.position;

import com.vaultengine.domain.Cdp;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CdpStore}. compareAndSet runs inside {@link ConcurrentHashMap#compute}, which locks the
 * entry, so the version check and the write are atomic.
 */
@Component
public class InMemoryCdpStore implements CdpStore {

    private final Map<String, Cdp> cdps = new ConcurrentHashMap<>();

    @Override
    public Optional<Cdp> findById(String id) {
        return Optional.ofNullable(cdps.get(id));
    }

    @Override
    public void insert(Cdp cdp) {
        if (cdps.putIfAbsent(cdp.getId(), cdp) != null) {
            throw new CdpServiceException(CdpServiceException.DUPLICATE_CDP, "CDP already exists: " + cdp.getId());
        }
    }

    @Override
    public boolean compareAndSet(long expectedVersion, Cdp updated) {
        Cdp stored = cdps.computeIfPresent(updated.getId(),
                (id, current) -> current.getVersion() == expectedVersion ? updated : current);
        return stored == updated;
    }

    @Override
    public BigInteger totalDebt() {
        return cdps.values().stream()
                .map(Cdp::getDebtAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }
}
