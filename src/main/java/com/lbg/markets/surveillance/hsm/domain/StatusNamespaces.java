package com.lbg.markets.surveillance.hsm.domain;

/**
 * Schema namespaces under which online status is recorded.
 * These identify stored records, so they must not change for a deployment.
 */
public final class StatusNamespaces {

    public static final String DATAFILE = "http://tardis.edu.au/schemas/hsm/datafile/1";
    public static final String DATASET = "http://tardis.edu.au/schemas/hsm/dataset/1";

    private StatusNamespaces() {
        // Constants
    }
}
