package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.util.Outcome;

import java.util.List;
import java.util.function.Consumer;

/**
 * Asks the HSM to bring files back online.
 */
public interface HsmRetriever {

    /**
     * Trigger recall of a single object. Succeeds when the recall request returned
     * without error, which need not mean the file is already online.
     *
     * @throws com.lbg.markets.surveillance.hsm.error.UnverifiedException if the object is not verified
     */
    void retrieve(StorageObject object, Consumer<Outcome<StorageObject>> callback);

    /**
     * Trigger recall of several objects. The callback is invoked once, with one
     * outcome per object in input order; unverified objects appear as failures.
     */
    void retrieveBatch(List<StorageObject> objects, Consumer<List<Outcome<StorageObject>>> callback);
}
