package com.lbg.markets.surveillance.hsm.domain;

import java.nio.file.Path;

/**
 * A stored replica of a datafile inside a storage box.
 */
public record StorageObject(
        String storageBoxId,
        String storageClass,
        Path location,
        boolean verified
) {
    public StorageObject {
        if (storageBoxId == null || storageBoxId.isBlank()) {
            throw new IllegalArgumentException("storageBoxId cannot be blank");
        }
        if (storageClass == null || storageClass.isBlank()) {
            throw new IllegalArgumentException("storageClass cannot be blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
    }
}
