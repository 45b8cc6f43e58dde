package com.lbg.markets.surveillance.hsm.lock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Process-local lock cache.
 * Only guards against duplicate work inside one JVM; a shared cache is needed across nodes.
 */
@ApplicationScoped
public class InMemoryLockCache implements LockCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    @Inject
    public InMemoryLockCache() {
        this(System::nanoTime);
    }

    public InMemoryLockCache(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    @Override
    public boolean add(String key, String value, Duration ttl) {
        long now = nanoClock.getAsLong();
        Entry candidate = new Entry(value, now + ttl.toNanos());
        Entry winner = entries.compute(key, (k, existing) ->
                existing == null || existing.expiredAt(now) ? candidate : existing);
        return winner == candidate;
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /**
     * Current holder of {@code key}, if unexpired.
     */
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.expiredAt(nanoClock.getAsLong())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    private record Entry(String value, long expiresAtNanos) {
        boolean expiredAt(long now) {
            return now - expiresAtNanos >= 0;
        }
    }
}
