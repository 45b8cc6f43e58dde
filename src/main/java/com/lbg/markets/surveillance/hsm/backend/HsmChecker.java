package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.util.Outcome;

import java.util.function.Consumer;

/**
 * Determines whether the file behind a storage object is online.
 * <p>
 * Calls return without waiting for the check. The callback is invoked exactly once
 * with the status or the failure, and should be quick: implementations may deliver
 * all results on a single thread.
 */
public interface HsmChecker {

    /**
     * Check online status using the checker's configured minimum file size.
     *
     * @throws com.lbg.markets.surveillance.hsm.error.UnverifiedException if the object
     *         is not verified; the callback is then never invoked
     */
    void online(StorageObject object, Consumer<Outcome<Boolean>> callback);

    /**
     * Check online status with an explicit minimum file size in bytes.
     */
    void online(StorageObject object, long minFileSize, Consumer<Outcome<Boolean>> callback);
}
