package com.lbg.markets.surveillance.hsm.error;

import java.util.Collection;

/**
 * The storage class of a replica is not one the filesystem probe can handle.
 * This is a configuration problem, not a transient one.
 */
public class StorageClassNotSupportedException extends HsmException {

    private final String storageClass;

    public StorageClassNotSupportedException(String storageClass, Collection<String> supported) {
        super(String.format(
                "Storage class '%s' is not supported for HSM status checks (supported: %s). "
                        + "If it is backed by a mounted filesystem, add it to hsm.storage-classes.",
                storageClass, supported));
        this.storageClass = storageClass;
    }

    public String storageClass() {
        return storageClass;
    }
}
