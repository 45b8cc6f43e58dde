package com.lbg.markets.surveillance.hsm.domain;

import java.util.Optional;

/**
 * A tracked file as the record-keeping catalog sees it.
 * Read-only to the status service.
 */
public record Datafile(
        long id,
        long datasetId,
        String filename,
        boolean verified,
        StorageObject preferredObject
) {
    public Datafile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename cannot be blank");
        }
    }

    public Optional<StorageObject> preferred() {
        return Optional.ofNullable(preferredObject);
    }
}
