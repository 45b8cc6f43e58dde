package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.error.UnverifiedException;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Backend for storage boxes without HSM: every file is online and every
 * retrieve succeeds. Callbacks run on the calling thread.
 */
@ApplicationScoped
public class NullHsmBackend implements HsmChecker, HsmRetriever {

    @Override
    public void online(StorageObject object, Consumer<Outcome<Boolean>> callback) {
        online(object, 0, callback);
    }

    @Override
    public void online(StorageObject object, long minFileSize, Consumer<Outcome<Boolean>> callback) {
        requireVerified(object);
        callback.accept(Outcome.success(true));
    }

    @Override
    public void retrieve(StorageObject object, Consumer<Outcome<StorageObject>> callback) {
        requireVerified(object);
        callback.accept(Outcome.success(object));
    }

    @Override
    public void retrieveBatch(List<StorageObject> objects, Consumer<List<Outcome<StorageObject>>> callback) {
        List<Outcome<StorageObject>> outcomes = new ArrayList<>(objects.size());
        for (StorageObject object : objects) {
            outcomes.add(object.verified()
                    ? Outcome.success(object)
                    : Outcome.failure(unverified(object)));
        }
        callback.accept(outcomes);
    }

    static void requireVerified(StorageObject object) {
        if (!object.verified()) {
            throw unverified(object);
        }
    }

    static UnverifiedException unverified(StorageObject object) {
        return new UnverifiedException("Storage object is not verified: " + object.location());
    }
}
