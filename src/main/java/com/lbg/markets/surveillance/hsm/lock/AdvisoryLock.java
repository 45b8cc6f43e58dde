package com.lbg.markets.surveillance.hsm.lock;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.function.LongSupplier;

/**
 * Cooperative, TTL-bounded lock over one datafile.
 * Use in try-with-resources and proceed only when {@link #isAcquired()} is true:
 * <pre>
 * try (AdvisoryLock lock = locks.lock(datafile.id(), ownerId)) {
 *     if (lock.isAcquired()) {
 *         ...
 *     }
 * }
 * </pre>
 * Release only deletes the token while this owner is still inside its own TTL
 * (less a safety margin); after that the token is left to expire in the cache,
 * as another owner may already hold it.
 */
public final class AdvisoryLock implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AdvisoryLock.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    static final Duration SAFETY_MARGIN = Duration.ofSeconds(3);

    private final LockCache cache;
    private final String lockKey;
    private final String ownerId;
    private final Instant createdAt;
    private final long releaseDeadlineNanos;
    private final LongSupplier nanoClock;
    private final boolean acquired;
    private boolean released;

    private AdvisoryLock(LockCache cache, String lockKey, String ownerId, Duration ttl, LongSupplier nanoClock) {
        this.cache = cache;
        this.lockKey = lockKey;
        this.ownerId = ownerId;
        this.nanoClock = nanoClock;
        this.createdAt = Instant.now();
        this.releaseDeadlineNanos = nanoClock.getAsLong() + ttl.minus(SAFETY_MARGIN).toNanos();
        this.acquired = cache.add(lockKey, ownerId, ttl);
    }

    public static AdvisoryLock acquire(LockCache cache, long datafileId, String ownerId, Duration ttl) {
        return acquire(cache, datafileId, ownerId, ttl, System::nanoTime);
    }

    public static AdvisoryLock acquire(LockCache cache, long datafileId, String ownerId, Duration ttl,
                                       LongSupplier nanoClock) {
        AdvisoryLock lock = new AdvisoryLock(cache, lockKey(datafileId), ownerId, ttl, nanoClock);
        if (!lock.acquired) {
            LOG.debugf("Lock %s already held, %s backing off", lock.lockKey, ownerId);
        }
        return lock;
    }

    public static String lockKey(long datafileId) {
        return "lock-" + datafileId;
    }

    public boolean isAcquired() {
        return acquired;
    }

    public String lockKey() {
        return lockKey;
    }

    public String ownerId() {
        return ownerId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Release the lock if held and still within this owner's TTL window.
     */
    public void release() {
        if (!acquired || released) {
            return;
        }
        released = true;
        if (nanoClock.getAsLong() - releaseDeadlineNanos < 0) {
            cache.delete(lockKey);
        } else {
            LOG.debugf("Lock %s outlived its TTL, leaving it to expire", lockKey);
        }
    }

    @Override
    public void close() {
        release();
    }
}
