package com.lbg.markets.surveillance.hsm.domain;

/**
 * Fired by the catalog after a datafile has been saved with a verified replica.
 */
public record DatafileVerified(Datafile datafile) {
    public DatafileVerified {
        if (datafile == null) {
            throw new IllegalArgumentException("datafile cannot be null");
        }
    }
}
