package com.lbg.markets.surveillance.hsm.lock;

import java.time.Duration;

/**
 * Shared key-value cache holding advisory lock tokens.
 */
public interface LockCache {

    /**
     * Store {@code value} under {@code key} unless an unexpired entry already exists.
     *
     * @return true if this call stored the entry
     */
    boolean add(String key, String value, Duration ttl);

    void delete(String key);
}
