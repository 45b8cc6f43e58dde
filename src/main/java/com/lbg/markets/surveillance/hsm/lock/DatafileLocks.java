package com.lbg.markets.surveillance.hsm.lock;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Hands out advisory locks over datafiles using the configured cache and TTL.
 */
@ApplicationScoped
public class DatafileLocks {

    private final LockCache cache;
    private final Duration ttl;

    public DatafileLocks(
            LockCache cache,
            @ConfigProperty(name = "hsm.lock.ttl", defaultValue = "PT300S") Duration ttl
    ) {
        this.cache = cache;
        this.ttl = ttl;
    }

    public AdvisoryLock lock(long datafileId, String ownerId) {
        return AdvisoryLock.acquire(cache, datafileId, ownerId, ttl);
    }
}
